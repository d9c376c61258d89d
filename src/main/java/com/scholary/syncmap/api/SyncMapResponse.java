package com.scholary.syncmap.api;

/** Result of an operation that wrote a file. */
public record SyncMapResponse(String outputPath, int fragmentCount, boolean singleLevel) {}
