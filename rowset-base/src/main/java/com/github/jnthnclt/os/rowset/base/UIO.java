/*
 * UIO.java
 *
 * Created on 03-12-2010 11:24:38 PM
 *
 * Copyright 2010 Jonathan Colt
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.jnthnclt.os.rowset.base;

import com.github.jnthnclt.os.rowset.io.IAppendOnly;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.io.IOException;

/**
 * Big endian codecs shared by every on disk structure.
 */
public class UIO {

    /**
     * Writes an int length followed by the bytes. A null array is written as length -1.
     */
    public static void writeByteArray(IAppendOnly appendOnly, byte[] array) throws IOException {
        if (array == null) {
            appendOnly.appendInt(-1);
            return;
        }
        appendOnly.appendInt(array.length);
        appendOnly.append(array, 0, array.length);
    }

    public static int byteArrayLength(byte[] array) {
        return 4 + (array == null ? 0 : array.length);
    }

    public static byte[] intBytes(int v) {
        return Ints.toByteArray(v);
    }

    public static byte[] intBytes(int v, byte[] bytes, int offset) {
        bytes[offset] = (byte) (v >>> 24);
        bytes[offset + 1] = (byte) (v >>> 16);
        bytes[offset + 2] = (byte) (v >>> 8);
        bytes[offset + 3] = (byte) v;
        return bytes;
    }

    public static int bytesInt(byte[] bytes) {
        return bytesInt(bytes, 0);
    }

    public static int bytesInt(byte[] bytes, int offset) {
        return Ints.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3]);
    }

    public static byte[] longBytes(long v) {
        return Longs.toByteArray(v);
    }

    public static byte[] longBytes(long v, byte[] bytes, int offset) {
        for (int i = 7; i >= 0; i--) {
            bytes[offset + i] = (byte) v;
            v >>>= 8;
        }
        return bytes;
    }

    public static long bytesLong(byte[] bytes) {
        return bytesLong(bytes, 0);
    }

    public static long bytesLong(byte[] bytes, int offset) {
        return Longs.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3],
            bytes[offset + 4], bytes[offset + 5], bytes[offset + 6], bytes[offset + 7]);
    }

    /**
     * Smallest power of two, but no less than {@code minPower}, whose chunk holds {@code length} bytes.
     */
    public static int chunkPower(long length, int minPower) {
        if (length == 0) {
            return 0;
        }
        return Math.max(minPower, 64 - Long.numberOfLeadingZeros(length - 1));
    }

    public static long chunkLength(int chunkPower) {
        return 1L << chunkPower;
    }

}
