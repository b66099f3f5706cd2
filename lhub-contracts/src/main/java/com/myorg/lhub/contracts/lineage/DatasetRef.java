package com.myorg.lhub.contracts.lineage;

/**
 * Logical dataset. {@code namespace} is the dataset's own namespace and may belong to another team.
 */
public record DatasetRef(String type, String name, String namespace, String format) {}
