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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class NoCryptoTest
{
	@Test
	public void dummySignatures () throws ValidationException
	{
		Crypto crypto = new NoCrypto ();
		Key key = crypto.generateKey ("low");
		byte[] signature = crypto.createSignature (key, Hash.sha256 (new byte[] { 1 }));
		assertEquals (60, signature.length);
		for ( byte b : signature )
		{
			assertEquals ('0', b);
		}
		assertTrue (crypto.isValidSignature (key, new byte[] { 2 }, new byte[3]));
		assertEquals (SignatureVerdict.VALID, crypto.checkSignature (key, null, null));
	}

	@Test
	public void realKeys () throws ValidationException
	{
		Crypto crypto = new NoCrypto ();
		Key key = crypto.generateKey ("very-low");
		Key restored = crypto.keyFromPublicPem (crypto.keyToPem (key.getReadOnly ()));
		assertEquals ("sect163k1", restored.getCurveName ());
		// real signatures still verify with ECCrypto
		assertTrue (new ECCrypto ().isValidSignature (key, Hash.sha256 (new byte[] { 1 }),
				new ECCrypto ().createSignature (key, Hash.sha256 (new byte[] { 1 }))));
	}
}
