package fun.fengwk.smh.core.service.catalog;

/**
 * Published tool set.
 *
 * @author fengwk
 */
public enum CatalogVariant {

    /**
     * text, news, images, videos and books search.
     */
    STANDARD,

    /**
     * text search with a backend selector plus news search.
     */
    METASEARCH

}
