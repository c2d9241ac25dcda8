package com.placementrag.trends;

public record CompanyCount(String company, int count) {
}
