/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.hadoop.fs.rgw;

import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.permission.FsPermission;

/**
 * POSIX-like attributes of a file handle, as returned by
 * {@link RGWFileHandle#stat()}.
 */
public final class RGWStat {
    public static final int S_IFMT = 0170000;

    public static final int S_IFDIR = 0040000;

    public static final int S_IFREG = 0100000;

    /** rwx for user, group and other. */
    public static final int RWXMODE = 0777;

    /** rw for user, group and other. */
    public static final int RWMODE = 0666;

    public static final int BLKSIZE = 4096;

    public static final int DIR_NLINK = 3;

    private final long dev;

    private final long ino;

    private final int mode;

    private final long nlink;

    private final int uid;

    private final int gid;

    private final long size;

    private final int blksize;

    private final long blocks;

    private final long atime;

    private final long mtime;

    private final long ctime;

    RGWStat(final long dev, final long ino, final int mode, final long nlink, final long size, final int blksize,
        final long blocks, final long atime, final long mtime, final long ctime) {
        this.dev = dev;
        this.ino = ino;
        this.mode = mode;
        this.nlink = nlink;
        this.uid = 0;
        this.gid = 0;
        this.size = size;
        this.blksize = blksize;
        this.blocks = blocks;
        this.atime = atime;
        this.mtime = mtime;
        this.ctime = ctime;
    }

    public long getDev() {
        return dev;
    }

    public long getIno() {
        return ino;
    }

    public int getMode() {
        return mode;
    }

    public long getNlink() {
        return nlink;
    }

    public int getUid() {
        return uid;
    }

    public int getGid() {
        return gid;
    }

    public long getSize() {
        return size;
    }

    public int getBlksize() {
        return blksize;
    }

    public long getBlocks() {
        return blocks;
    }

    /**
     * @return access time, milliseconds since the epoch
     */
    public long getAtime() {
        return atime;
    }

    /**
     * @return modification time, milliseconds since the epoch
     */
    public long getMtime() {
        return mtime;
    }

    /**
     * @return change time, milliseconds since the epoch
     */
    public long getCtime() {
        return ctime;
    }

    public boolean isDirectory() {
        return (mode & S_IFMT) == S_IFDIR;
    }

    public boolean isFile() {
        return (mode & S_IFMT) == S_IFREG;
    }

    /**
     * Project these attributes onto a Hadoop {@link FileStatus}.
     *
     * @param path path to report
     * @return file status of {@code path}
     */
    public FileStatus toFileStatus(final Path path) {
        return new FileStatus(size, isDirectory(), 1, blksize, mtime, atime,
            new FsPermission((short) (mode & RWXMODE)), String.valueOf(uid), String.valueOf(gid), path);
    }

    @Override
    public String toString() {
        return "RGWStat{ino=" + Long.toUnsignedString(ino)
            + ", mode=0" + Integer.toOctalString(mode)
            + ", nlink=" + nlink
            + ", size=" + size
            + ", blocks=" + blocks
            + ", mtime=" + mtime + '}';
    }
}
