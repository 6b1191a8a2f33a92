/*
 * Copyright 2013 bits of proof zrt.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bitsofproof.overlay.core;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Byte level encoding of the walk messages. Integers are little endian, variable length fields carry a var-int length prefix.
 */
public class WireFormat
{
	public static class Reader
	{
		private final byte[] bytes;
		private int cursor;

		public Reader (byte[] bytes)
		{
			this.bytes = bytes;
			this.cursor = 0;
		}

		public boolean eof ()
		{
			return cursor >= bytes.length;
		}

		public int readByte ()
		{
			return bytes[cursor++] & 0xff;
		}

		public int readUint16 ()
		{
			int value = (bytes[cursor] & 0xff) | ((bytes[cursor + 1] & 0xff) << 8);
			cursor += 2;
			return value;
		}

		public long readUint32 ()
		{
			long value =
					(bytes[cursor] & 0xFFL) | ((bytes[cursor + 1] & 0xFFL) << 8) | ((bytes[cursor + 2] & 0xFFL) << 16)
							| ((bytes[cursor + 3] & 0xFFL) << 24);
			cursor += 4;
			return value;
		}

		public long readVarInt ()
		{
			int vi = readByte ();
			if ( vi < 0xfd )
			{
				return vi;
			}
			if ( vi == 0xfd )
			{
				return readUint16 ();
			}
			if ( vi == 0xfe )
			{
				return readUint32 ();
			}
			throw new IllegalArgumentException ("Var-int too long");
		}

		public byte[] readBytes (int length)
		{
			if ( length < 0 || cursor + length > bytes.length )
			{
				throw new ArrayIndexOutOfBoundsException ("Read past end: " + length + " bytes at " + cursor);
			}
			byte[] b = new byte[length];
			System.arraycopy (bytes, cursor, b, 0, length);
			cursor += length;
			return b;
		}

		public byte[] readVarBytes ()
		{
			long len = readVarInt ();
			if ( len > bytes.length )
			{
				throw new ArrayIndexOutOfBoundsException ("Length " + len + " exceeds message");
			}
			return readBytes ((int) len);
		}

		public String readString ()
		{
			return new String (readVarBytes (), StandardCharsets.UTF_8);
		}

		/**
		 * @return the address, or null if the writer had none
		 */
		public Address readAddress ()
		{
			String host = readString ();
			int port = readUint16 ();
			if ( host.isEmpty () )
			{
				return null;
			}
			return new Address (host, port);
		}
	}

	public static class Writer
	{
		private final ByteArrayOutputStream bs = new ByteArrayOutputStream ();

		public byte[] toByteArray ()
		{
			return bs.toByteArray ();
		}

		public void writeByte (int n)
		{
			bs.write (n);
		}

		public void writeUint16 (int n)
		{
			bs.write (0xFF & n);
			bs.write (0xFF & (n >> 8));
		}

		public void writeUint32 (long n)
		{
			bs.write ((int) (0xFF & n));
			bs.write ((int) (0xFF & (n >> 8)));
			bs.write ((int) (0xFF & (n >> 16)));
			bs.write ((int) (0xFF & (n >> 24)));
		}

		public void writeVarInt (long n)
		{
			if ( n < 0xfd )
			{
				bs.write ((int) n);
			}
			else if ( n < 0x10000 )
			{
				bs.write (0xfd);
				writeUint16 ((int) n);
			}
			else
			{
				bs.write (0xfe);
				writeUint32 (n);
			}
		}

		public void writeBytes (byte[] b)
		{
			bs.write (b, 0, b.length);
		}

		public void writeVarBytes (byte[] b)
		{
			writeVarInt (b.length);
			writeBytes (b);
		}

		public void writeString (String s)
		{
			writeVarBytes (s == null ? new byte[0] : s.getBytes (StandardCharsets.UTF_8));
		}

		/**
		 * Host and port; an absent address is written as empty host and port 0.
		 */
		public void writeAddress (Address address)
		{
			if ( address == null )
			{
				writeString ("");
				writeUint16 (0);
			}
			else
			{
				writeString (address.getHost ());
				writeUint16 (address.getPort ());
			}
		}
	}
}
