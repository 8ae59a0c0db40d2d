package com.policywatch.ingest.adapter;

public enum AdapterType {
    /** Paged HTML listing of links to detail pages or documents */
    LISTING,
    /** RSS 2.0 or Atom feed */
    RSS
}
