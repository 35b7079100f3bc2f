package com.sidr;

public final class Constants {
    public static final int FILE_SIGNATURE = 0x89ABCDEF;
    public static final int FORMAT_VERSION = 0x620;
    public static final int MIN_FORMAT_REVISION = 0x09;
    public static final int MAX_FORMAT_REVISION = 0x20;
    public static final int MIN_PAGE_SIZE = 2048;
    public static final int MAX_PAGE_SIZE = 32768;

    // Primary header and its shadow copy occupy the first two page-sized blocks.
    public static final int HEADER_READ_BYTES = 668;

    public static final int PAGE_HEADER_BYTES = 40;
    public static final int EXTENDED_PAGE_HEADER_BYTES = 80;
    public static final int LARGE_PAGE_SIZE = 16384;
    public static final int EXTENDED_HEADER_REVISION = 0x11;
    public static final int ECC_CHECKSUM_REVISION = 0x0B;
    /** Offsets of the per-block checksums of a large-layout page, one block per quarter. */
    public static final int[] LARGE_PAGE_CHECKSUM_OFFSETS = {0, 40, 48, 56};
    public static final int PAGE_TAG_BYTES = 4;

    public static final int CATALOG_ROOT_PAGE = 4;
    public static final int SHADOW_CATALOG_ROOT_PAGE = 24;
    public static final String CATALOG_TABLE_NAME = "MSysObjects";

    public static final int FIRST_FIXED_COLUMN = 1;
    public static final int LAST_FIXED_COLUMN = 127;
    public static final int FIRST_VARIABLE_COLUMN = 128;
    public static final int LAST_VARIABLE_COLUMN = 255;
    public static final int FIRST_TAGGED_COLUMN = 256;

    public static final String ESE_FILE_NAME = "Windows.edb";
    public static final String SQLITE_FILE_NAME = "Windows.db";

    private Constants() {}
}
