package com.myorg.lhub.ingestion.namespace;

import java.time.LocalDate;

public record NamespaceUsage(String namespace, LocalDate date, long used, long limit, long remaining) {}
