/*
 * Copyright 2013 Jive Software, Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package com.github.jnthnclt.os.rowset.io;

import com.github.jnthnclt.os.rowset.base.BolBuffer;
import com.github.jnthnclt.os.rowset.base.UIO;
import com.google.common.math.IntMath;
import java.io.IOException;

/**
 * Heap backed {@link IAppendOnly} used to stage a block (or an index / footer entry) before it is appended to a file.
 *
 * Not thread safe.
 */
public class AppendableHeap implements IAppendOnly {

    private byte[] bytes;
    private int fp = 0;

    public AppendableHeap(int initialSize) {
        bytes = new byte[initialSize];
    }

    public byte[] getBytes() {
        byte[] copy = new byte[fp];
        System.arraycopy(bytes, 0, copy, 0, fp);
        return copy;
    }

    public byte[] leakBytes() {
        return bytes;
    }

    public void reset() {
        fp = 0;
    }

    private void ensure(int amount) {
        if (fp + amount > bytes.length) {
            bytes = grow(bytes, Math.max((fp + amount) - bytes.length, bytes.length));
        }
    }

    @Override
    public void appendByte(byte b) throws IOException {
        ensure(1);
        bytes[fp] = b;
        fp++;
    }

    @Override
    public void appendInt(int i) throws IOException {
        ensure(4);
        UIO.intBytes(i, bytes, fp);
        fp += 4;
    }

    @Override
    public void appendLong(long l) throws IOException {
        ensure(8);
        UIO.longBytes(l, bytes, fp);
        fp += 8;
    }

    @Override
    public void append(byte[] b, int offset, int length) throws IOException {
        ensure(length);
        System.arraycopy(b, offset, bytes, fp, length);
        fp += length;
    }

    @Override
    public void append(BolBuffer bolBuffer) throws IOException {
        if (bolBuffer.bb != null) {
            ensure(bolBuffer.length);
            for (int i = 0; i < bolBuffer.length; i++) {
                bytes[fp + i] = bolBuffer.bb.get(bolBuffer.offset + i);
            }
            fp += bolBuffer.length;
        } else {
            append(bolBuffer.bytes, bolBuffer.offset, bolBuffer.length);
        }
    }

    @Override
    public long getFilePointer() throws IOException {
        return fp;
    }

    @Override
    public long length() throws IOException {
        return fp;
    }

    @Override
    public void close() throws IOException {
    }

    @Override
    public void flush(boolean fsync) throws IOException {
    }

    static private byte[] grow(byte[] src, int amount) {
        if (src == null) {
            return new byte[amount];
        }
        byte[] newSrc = new byte[IntMath.checkedAdd(src.length, amount)];
        System.arraycopy(src, 0, newSrc, 0, src.length);
        return newSrc;
    }

}
