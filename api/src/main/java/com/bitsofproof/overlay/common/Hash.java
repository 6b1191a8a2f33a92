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
package com.bitsofproof.overlay.common;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class Hash
{
	private Hash ()
	{
	}

	/**
	 * Digest of a message as handed to {@link Crypto#createSignature(Key, byte[])}.
	 */
	public static byte[] sha256 (byte[] data)
	{
		return digest ("SHA-256", data);
	}

	/**
	 * Member identifier: SHA-1 over the binary public key.
	 */
	public static byte[] keyHash (byte[] publicBin)
	{
		return digest ("SHA-1", publicBin);
	}

	private static byte[] digest (String algorithm, byte[] data)
	{
		try
		{
			MessageDigest a = MessageDigest.getInstance (algorithm);
			return a.digest (data);
		}
		catch ( NoSuchAlgorithmException e )
		{
			throw new RuntimeException (e);
		}
	}
}
