package com.demoAuto.salesAgent.retrieval;

public record ScoredItem<T>(T item, double score) {
}
