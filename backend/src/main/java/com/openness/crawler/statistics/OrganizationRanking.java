package com.openness.crawler.statistics;

public record OrganizationRanking(String organizationName, double fulfillmentPercentage) {
}
