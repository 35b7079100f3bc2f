package com.sidr.core;

import com.sidr.Constants;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.util.EseBuffer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Positioned, read-only access to the pages of a database file.
 * <p>
 * Logical page {@code n} (1-based) lives at file offset {@code (n + 1) * pageSize}; the
 * first two page-sized blocks hold the file header and its shadow copy. Reads go through
 * {@link FileChannel#read(ByteBuffer, long)} and are safe to issue from several threads.
 */
@Slf4j
public final class PageReader implements Closeable {

    private static final int CHECKSUM_SEED = 0x89ABCDEF;

    private final FileChannel channel;
    @Getter
    private final Path path;
    @Getter
    private final FileHeader header;
    @Getter
    private final int pageCount;
    private final boolean verifyChecksums;

    private PageReader(Path path, FileChannel channel, FileHeader header, boolean verifyChecksums) throws IOException {
        this.path = path;
        this.channel = channel;
        this.header = header;
        this.verifyChecksums = verifyChecksums;
        long pages = channel.size() / header.getPageSize() - 2;
        this.pageCount = (int) Math.max(0, Math.min(Integer.MAX_VALUE, pages));
    }

    public static PageReader open(Path path, boolean verifyChecksums) throws SidrException {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new SidrException(ErrorType.IO_ERROR, "Cannot open " + path, e);
        }
        try {
            var header = readHeader(channel);
            log.debug("{}: format 0x{} revision 0x{}, page size {}, state {}", path,
                    Integer.toHexString(header.getFormatVersion()), Integer.toHexString(header.getFormatRevision()),
                    header.getPageSize(), header.getDatabaseState());
            return new PageReader(path, channel, header, verifyChecksums);
        } catch (SidrException | IOException | RuntimeException e) {
            closeQuietly(channel, e);
            if (e instanceof SidrException) {
                throw (SidrException) e;
            }
            throw new SidrException(ErrorType.IO_ERROR, "Cannot read header of " + path, e);
        }
    }

    /**
     * Try the primary header, then the shadow copy one page further in.
     */
    private static FileHeader readHeader(FileChannel channel) throws SidrException, IOException {
        SidrException primaryFailure;
        try {
            return FileHeader.parse(readBlock(channel, 0, Constants.HEADER_READ_BYTES, ErrorType.INVALID_SIGNATURE));
        } catch (SidrException e) {
            if (e.getErrorType() == ErrorType.UNSUPPORTED_VERSION) {
                throw e;
            }
            primaryFailure = e;
        }
        for (int pageSize = Constants.MIN_PAGE_SIZE; pageSize <= Constants.MAX_PAGE_SIZE; pageSize <<= 1) {
            if (channel.size() < pageSize + Constants.HEADER_READ_BYTES) {
                break;
            }
            try {
                var shadow = FileHeader.parse(readBlock(channel, pageSize, Constants.HEADER_READ_BYTES,
                        ErrorType.INVALID_SIGNATURE));
                if (shadow.getPageSize() == pageSize) {
                    log.warn("Primary file header unusable ({}), using shadow header at offset {}",
                            primaryFailure.getMessage(), pageSize);
                    return shadow;
                }
            } catch (SidrException e) {
                log.debug("No shadow header at offset {}: {}", pageSize, e.getMessage());
            }
        }
        throw primaryFailure;
    }

    /**
     * Read and validate one page.
     */
    public Page readPage(int pageNumber) throws SidrException {
        if (pageNumber < 1 || pageNumber > pageCount) {
            throw new SidrException(ErrorType.OUT_OF_RANGE,
                    "Page " + pageNumber + " outside 1.." + pageCount);
        }
        int pageSize = header.getPageSize();
        long position = (long) (pageNumber + 1) * pageSize;
        EseBuffer data;
        try {
            data = readBlock(channel, position, pageSize, ErrorType.CORRUPT_PAGE);
        } catch (IOException e) {
            throw new SidrException(ErrorType.IO_ERROR, "Cannot read page " + pageNumber, e);
        }
        if (verifyChecksums) {
            verifyChecksum(pageNumber, data);
        }
        return new Page(pageNumber, data, header);
    }

    /**
     * XOR checksums over little-endian words. Pages in the large layout carry one checksum
     * per quarter of the page: the first at offset 0, the other three in the extended header.
     */
    private void verifyChecksum(int pageNumber, EseBuffer data) throws SidrException {
        int pageSize = data.capacity();
        if (header.isLargePageLayout()) {
            int blockSize = pageSize / Constants.LARGE_PAGE_CHECKSUM_OFFSETS.length;
            for (int block = 0; block < Constants.LARGE_PAGE_CHECKSUM_OFFSETS.length; block++) {
                int start = block == 0 ? 8 : block * blockSize;
                int checksum = xor(data, CHECKSUM_SEED ^ pageNumber, start, (block + 1) * blockSize);
                compare(pageNumber, block, data.getInt(Constants.LARGE_PAGE_CHECKSUM_OFFSETS[block]), checksum);
            }
            return;
        }
        boolean eccLayout = header.getFormatRevision() >= Constants.ECC_CHECKSUM_REVISION;
        int checksum = xor(data, eccLayout ? CHECKSUM_SEED ^ pageNumber : CHECKSUM_SEED, eccLayout ? 8 : 4, pageSize);
        compare(pageNumber, 0, data.getInt(0), checksum);
    }

    private static int xor(EseBuffer data, int seed, int from, int to) throws SidrException {
        int checksum = seed;
        for (int offset = from; offset < to; offset += 4) {
            checksum ^= data.getInt(offset);
        }
        return checksum;
    }

    private static void compare(int pageNumber, int block, int stored, int computed) throws SidrException {
        if (stored != computed) {
            throw new SidrException(ErrorType.CORRUPT_PAGE, String.format(
                    "Page %d block %d checksum mismatch: stored 0x%08x, computed 0x%08x",
                    pageNumber, block, stored, computed));
        }
    }

    private static EseBuffer readBlock(FileChannel channel, long position, int length, ErrorType underflowError)
            throws IOException {
        var buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0) {
                break;
            }
        }
        return new EseBuffer(buffer.array(), 0, buffer.position(), underflowError);
    }

    private static void closeQuietly(FileChannel channel, Exception primary) {
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
