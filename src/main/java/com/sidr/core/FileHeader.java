package com.sidr.core;

import com.sidr.Constants;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.util.EseBuffer;
import lombok.Value;

/**
 * The database file header, read once when a store is opened.
 */
@Value
public class FileHeader {
    static final int OFFSET_CHECKSUM = 0;
    static final int OFFSET_SIGNATURE = 4;
    static final int OFFSET_FORMAT_VERSION = 8;
    static final int OFFSET_FILE_TYPE = 12;
    static final int OFFSET_DATABASE_STATE = 52;
    static final int OFFSET_FORMAT_REVISION = 232;
    static final int OFFSET_PAGE_SIZE = 236;

    int checksum;
    int formatVersion;
    int fileType;
    DatabaseState databaseState;
    int formatRevision;
    int pageSize;

    public enum DatabaseState {
        UNKNOWN,
        JUST_CREATED,
        DIRTY_SHUTDOWN,
        CLEAN_SHUTDOWN,
        BEING_CONVERTED,
        FORCE_DETACH;

        static DatabaseState fromCode(int code) {
            var states = values();
            return code > 0 && code < states.length ? states[code] : UNKNOWN;
        }
    }

    /**
     * Pages of 16 KiB and more from revision 0x11 on use the extended header and
     * keep tag flags inside the value data.
     */
    public boolean isLargePageLayout() {
        return pageSize >= Constants.LARGE_PAGE_SIZE && formatRevision >= Constants.EXTENDED_HEADER_REVISION;
    }

    public int pageHeaderSize() {
        return isLargePageLayout() ? Constants.EXTENDED_PAGE_HEADER_BYTES : Constants.PAGE_HEADER_BYTES;
    }

    public static FileHeader parse(EseBuffer buffer) throws SidrException {
        int signature = buffer.getInt(OFFSET_SIGNATURE);
        if (signature != Constants.FILE_SIGNATURE) {
            throw new SidrException(ErrorType.INVALID_SIGNATURE,
                    "Invalid file signature: 0x" + Integer.toHexString(signature));
        }
        var header = new FileHeader(
                buffer.getInt(OFFSET_CHECKSUM),
                buffer.getInt(OFFSET_FORMAT_VERSION),
                buffer.getInt(OFFSET_FILE_TYPE),
                DatabaseState.fromCode(buffer.getInt(OFFSET_DATABASE_STATE)),
                buffer.getInt(OFFSET_FORMAT_REVISION),
                buffer.getInt(OFFSET_PAGE_SIZE));
        header.validate();
        return header;
    }

    private void validate() throws SidrException {
        if (formatVersion != Constants.FORMAT_VERSION) {
            throw new SidrException(ErrorType.UNSUPPORTED_VERSION,
                    "Unsupported format version: 0x" + Integer.toHexString(formatVersion));
        }
        if (formatRevision < Constants.MIN_FORMAT_REVISION || formatRevision > Constants.MAX_FORMAT_REVISION) {
            throw new SidrException(ErrorType.UNSUPPORTED_VERSION,
                    "Unsupported format revision: 0x" + Integer.toHexString(formatRevision));
        }
        if (pageSize < Constants.MIN_PAGE_SIZE || pageSize > Constants.MAX_PAGE_SIZE
                || Integer.bitCount(pageSize) != 1) {
            throw new SidrException(ErrorType.CORRUPT_PAGE, "Invalid page size: " + pageSize);
        }
    }
}
