package org.iceforge.imagecache.catalog;

import java.util.Objects;

/**
 * Where a product's assets live in the blob store: {@code {mainCategory}/{subCategory}/{productId}/}.
 */
public record ProductRef(String mainCategory, int subCategory, String productId) {

    public ProductRef {
        Objects.requireNonNull(mainCategory, "mainCategory");
        Objects.requireNonNull(productId, "productId");
        if (mainCategory.isBlank() || productId.isBlank()) {
            throw new IllegalArgumentException("mainCategory and productId are required");
        }
    }

    public String prefix() {
        return mainCategory + "/" + subCategory + "/" + productId + "/";
    }
}
