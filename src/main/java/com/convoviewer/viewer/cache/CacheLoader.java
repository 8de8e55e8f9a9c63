package com.convoviewer.viewer.cache;

@FunctionalInterface
public interface CacheLoader<T> {

    T load() throws Exception;
}
