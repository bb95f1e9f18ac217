package org.iceforge.imagecache.catalog;

import org.iceforge.imagecache.download.DownloadTask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Produces fetchable tasks for a product's assets. Fetch URLs are time-limited; an expired
 * URL simply fails that one task.
 */
public interface DownloadTaskSource {

    /** One task per asset in each of the product's known folders. */
    List<DownloadTask> tasksFor(ProductRef product);

    /** The task for the product's {@code meta.json} sidecar, if the product has one. */
    Optional<DownloadTask> companionTaskFor(ProductRef product);

    /**
     * Assets and sidecars for a whole page, in page order.
     */
    default List<DownloadTask> pageTasks(Collection<ProductRef> products) {
        List<DownloadTask> out = new ArrayList<>();
        for (ProductRef p : products) {
            out.addAll(tasksFor(p));
            companionTaskFor(p).ifPresent(out::add);
        }
        return out;
    }
}
