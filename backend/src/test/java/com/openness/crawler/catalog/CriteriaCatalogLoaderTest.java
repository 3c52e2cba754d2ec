package com.openness.crawler.catalog;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CriteriaCatalogLoaderTest {

    private final CriteriaCatalogLoader loader = new CriteriaCatalogLoader(catalogDirectory());

    @Test
    void listsCatalogFilesOfBothExtensions() {
        assertThat(loader.availableCatalogs()).containsExactly("bad_type", "missing_type", "sample");
    }

    @Test
    void flattensDimensionsFactorsAndCriteriaInFileOrder() {
        CriteriaCatalog catalog = loader.load("sample");

        assertEquals("Hochschulen", catalog.metadata().name());
        assertEquals("hochschulen", catalog.metadata().organizationType());
        assertThat(catalog.dimensionNames()).containsKeys("offenes_wissen", "transparenz");
        assertThat(catalog.criteria()).extracting(CriterionDefinition::id).containsExactly(
            "open_access_anteil",
            "open_access_policy",
            "forschungsdatenmanagement",
            "jahresbericht",
            "open_data_portal"
        );

        CriterionDefinition jahresbericht = catalog.criteria().get(3);
        assertEquals("transparenz", jahresbericht.dimension());
        assertEquals("berichterstattung", jahresbericht.factor());
        assertEquals(CriterionType.OPERATIONAL, jahresbericht.type());
        assertEquals(0.3, jahresbericht.confidenceThreshold());
        assertThat(jahresbericht.patterns().get(PatternType.URL)).containsExactly("/jahresbericht", "/annual-report");

        CriterionDefinition openData = catalog.criteria().get(4);
        assertNull(openData.confidenceThreshold());
        assertEquals(0.5, openData.effectiveThreshold(0.5));
        assertThat(openData.patterns()).containsOnlyKeys(PatternType.TEXT, PatternType.LOGO);
    }

    @Test
    void catalogInfoCountsDimensionsAndCriteria() {
        CatalogInfo info = loader.catalogInfo("sample");

        assertEquals("Hochschulen", info.name());
        assertEquals(2, info.dimensions());
        assertEquals(5, info.totalCriteria());
    }

    @Test
    void unknownCatalogIsNotFound() {
        assertThatThrownBy(() -> loader.load("does_not_exist"))
            .isInstanceOf(CatalogNotFoundException.class)
            .hasMessageContaining("does_not_exist");
    }

    @Test
    void pathTraversalNamesAreRejected() {
        assertThatThrownBy(() -> loader.load("../catalogs/sample")).isInstanceOf(CatalogNotFoundException.class);
    }

    @Test
    void missingCriterionKeyNamesTheKey() {
        assertThatThrownBy(() -> loader.load("missing_type"))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("c1")
            .hasMessageContaining("type");
    }

    @Test
    void invalidCriterionTypeIsRejected() {
        assertThatThrownBy(() -> loader.load("bad_type"))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("invalid type");
    }

    @Test
    void missingTopLevelKeysAreListed() throws Exception {
        assertThatThrownBy(() -> loader.parse("inline", new YAMLMapper().readTree("metadata:\n  name: x\n")))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("dimensions");
    }

    @Test
    void unknownPatternTypesAreSkipped() throws Exception {
        String yaml = """
            metadata:
              name: "Inline"
              organization_type: "test"
            dimensions:
              d1:
                factors:
                  f1:
                    criteria:
                      c1:
                        name: "C1"
                        description: "d"
                        type: "strategic"
                        patterns:
                          text: ["a"]
                          audio: ["jingle"]
                        weight: 2.5
            """;

        CriteriaCatalog catalog = loader.parse("inline", new YAMLMapper().readTree(yaml));

        CriterionDefinition c1 = catalog.criteria().get(0);
        assertThat(c1.patterns()).containsOnlyKeys(PatternType.TEXT);
        assertEquals(2.5, c1.weight());
        assertEquals("d1", catalog.dimensionName("d1"));
    }

    @Test
    void invalidYamlIsReportedAsCatalogError(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("broken.yaml"), "metadata: [unclosed\n");

        CriteriaCatalogLoader tempLoader = new CriteriaCatalogLoader(dir);

        assertThatThrownBy(() -> tempLoader.load("broken"))
            .isInstanceOf(CatalogException.class)
            .isNotInstanceOf(CatalogNotFoundException.class);
    }

    @Test
    void missingDirectoryHasNoCatalogs(@TempDir Path dir) {
        assertEquals(List.of(), new CriteriaCatalogLoader(dir.resolve("absent")).availableCatalogs());
    }

    private static Path catalogDirectory() {
        try {
            return Path.of(CriteriaCatalogLoaderTest.class.getResource("/catalogs").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
