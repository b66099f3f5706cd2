package com.myorg.lhub.contracts.lineage;

public record JobRef(String namespace, String name) {}
