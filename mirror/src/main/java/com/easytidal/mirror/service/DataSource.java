package com.easytidal.mirror.service;

/** Where a snapshot handed to a caller came from. */
public enum DataSource {
    CACHE,
    FRESH
}
