package com.kotsin.advisor.indicator;

public record BollingerBands(double upper, double middle, double lower) {
}
