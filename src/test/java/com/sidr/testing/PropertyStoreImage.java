package com.sidr.testing;

import com.sidr.record.TaggedFlags;
import com.sidr.types.ColumnType;
import com.sidr.types.ColumnValues;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A small {@code Windows.edb} with a {@code SystemIndex_PropertyStore} table.
 * <p>
 * Columns: WorkID (fixed 1), ItemPathDisplay (variable 128), and tagged Search_Store,
 * ComputerName, DateModified (FILETIME bytes), ItemType, ItemUrl, AutoSummary (256..261).
 * AutoSummary values are stored in the long-value tree.
 */
public final class PropertyStoreImage {
    public static final String TABLE = "SystemIndex_PropertyStore";
    public static final int TABLE_OBJECT_ID = 10;
    public static final int TABLE_ROOT = 30;
    public static final int LV_OBJECT_ID = 11;
    public static final int LV_ROOT = 31;

    private static final int UNICODE = ColumnValues.CODE_PAGE_UNICODE;

    private final List<byte[][]> rows = new ArrayList<>();
    private final List<byte[][]> longValues = new ArrayList<>();
    private int nextLongValueId = 1;

    public static final class Item {
        private final int workId;
        private String path;
        private String store;
        private String computerName;
        private Long dateModified;
        private String itemType;
        private String url;
        private String summary;

        private Item(int workId) {
            this.workId = workId;
        }

        public Item path(String value) {
            this.path = value;
            return this;
        }

        public Item store(String value) {
            this.store = value;
            return this;
        }

        public Item computerName(String value) {
            this.computerName = value;
            return this;
        }

        public Item dateModified(long filetime) {
            this.dateModified = filetime;
            return this;
        }

        public Item itemType(String value) {
            this.itemType = value;
            return this;
        }

        public Item url(String value) {
            this.url = value;
            return this;
        }

        public Item summary(String value) {
            this.summary = value;
            return this;
        }
    }

    public static Item item(int workId) {
        return new Item(workId);
    }

    public PropertyStoreImage add(Item item) {
        var record = new RecordEncoder().fixed(Bytes.int32(item.workId));
        if (item.path != null) {
            record.variable(Bytes.utf16(item.path));
        }
        if (item.store != null) {
            record.tagged(256, Bytes.utf16(item.store));
        }
        if (item.computerName != null) {
            record.tagged(257, Bytes.utf16(item.computerName));
        }
        if (item.dateModified != null) {
            record.tagged(258, Bytes.int64(item.dateModified));
        }
        if (item.itemType != null) {
            record.tagged(259, Bytes.utf16(item.itemType));
        }
        if (item.url != null) {
            record.tagged(260, Bytes.utf16(item.url));
        }
        if (item.summary != null) {
            int id = nextLongValueId++;
            byte[] data = Bytes.utf16(item.summary);
            longValues.add(new byte[][] {Bytes.bigEndian32(id), Bytes.concat(Bytes.int32(1), Bytes.int32(data.length))});
            longValues.add(new byte[][] {Bytes.concat(Bytes.bigEndian32(id), Bytes.bigEndian32(0)), data});
            record.tagged(261, TaggedFlags.LONG_VALUE, Bytes.int32(id));
        }
        return addRaw(item.workId, record.encode());
    }

    /**
     * Add a row with arbitrary record bytes.
     */
    public PropertyStoreImage addRaw(int workId, byte[] record) {
        rows.add(new byte[][] {Bytes.bigEndian32(workId), record});
        return this;
    }

    public EseImageBuilder builder() {
        var builder = new EseImageBuilder()
                .catalogTable(TABLE_OBJECT_ID, TABLE, TABLE_ROOT)
                .catalogColumn(TABLE_OBJECT_ID, 1, "WorkID", ColumnType.LONG, 4, 0)
                .catalogColumn(TABLE_OBJECT_ID, 128, "4447-System_ItemPathDisplay", ColumnType.TEXT, 0, UNICODE)
                .catalogColumn(TABLE_OBJECT_ID, 256, "4625-System_Search_Store", ColumnType.LONG_TEXT, 0, UNICODE)
                .catalogColumn(TABLE_OBJECT_ID, 257, "4099-System_ComputerName", ColumnType.LONG_TEXT, 0, UNICODE)
                .catalogColumn(TABLE_OBJECT_ID, 258, "15-System_DateModified", ColumnType.LONG_BINARY, 0, 0)
                .catalogColumn(TABLE_OBJECT_ID, 259, "4416-System_ItemType", ColumnType.LONG_TEXT, 0, UNICODE)
                .catalogColumn(TABLE_OBJECT_ID, 260, "4594-System_ItemUrl", ColumnType.LONG_TEXT, 0, UNICODE)
                .catalogColumn(TABLE_OBJECT_ID, 261, "4370-System_Search_AutoSummary", ColumnType.LONG_TEXT, 0, UNICODE)
                .catalogLongValues(TABLE_OBJECT_ID, LV_OBJECT_ID, LV_ROOT)
                .writeCatalog(true)
                .singlePageTree(TABLE_ROOT, TABLE_OBJECT_ID, rows);
        var lvPage = new PageImage(LV_OBJECT_ID, PageImage.ROOT | PageImage.LEAF | PageImage.LONG_VALUE);
        for (var entry : longValues) {
            lvPage.entry(entry[0], entry[1]);
        }
        return builder.page(LV_ROOT, lvPage);
    }

    public Path writeTo(Path path) throws IOException {
        return builder().writeTo(path);
    }
}
