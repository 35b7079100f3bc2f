package com.sidr.catalog;

import lombok.Value;

/**
 * One decoded row of the catalog table.
 * <p>
 * The meaning of {@code id} and {@code typeOrPage} depends on the entry type: for a table
 * they are its object id and root page, for a column its column id and column type, for an
 * index or long-value tree its object id and root page.
 */
@Value
public class CatalogEntry {
    int tableObjectId;
    CatalogEntryType type;
    int id;
    int typeOrPage;
    int spaceUsage;
    int flags;
    int pagesOrLocale;
    String name;
}
