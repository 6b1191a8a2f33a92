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

import java.util.Arrays;

/**
 * Keys as {@link ECCrypto}, but signatures are a dummy of the right length and every signature is accepted. Saves the CPU in tests and simulations.
 */
public class NoCrypto extends ECCrypto
{
	@Override
	public byte[] createSignature (Key key, byte[] digest)
	{
		byte[] signature = new byte[getSignatureLength (key)];
		Arrays.fill (signature, (byte) '0');
		return signature;
	}

	@Override
	public SignatureVerdict checkSignature (Key key, byte[] digest, byte[] signature)
	{
		return SignatureVerdict.VALID;
	}

	@Override
	public boolean isValidSignature (Key key, byte[] digest, byte[] signature)
	{
		return true;
	}
}
