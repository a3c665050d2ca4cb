package com.invertedindex.storage;

import java.util.function.Supplier;

/**
 * 可选的存储格式，CLI 通过名称选择。
 */
public enum StorageFormat {
    BINARY(BinaryStoragePolicy::new),
    JSON(JsonStoragePolicy::new);

    private final Supplier<StoragePolicy> policyFactory;

    StorageFormat(Supplier<StoragePolicy> policyFactory) {
        this.policyFactory = policyFactory;
    }

    public StoragePolicy createPolicy() {
        return policyFactory.get();
    }
}
