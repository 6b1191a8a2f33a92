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

import java.util.List;

/**
 * Key handling and message authentication used by the overlay.
 *
 * Signatures are the two DSA scalars r and s, each written big-endian in exactly {@code getSignatureLength (key) / 2} bytes and concatenated. There is no
 * ASN.1 wrapper and no length prefix; the length follows from the signer's curve.
 *
 * The is-valid methods take input straight from the network and return false on anything they can not use. They do not throw.
 */
public interface Crypto
{
	/**
	 * @return the named security levels followed by every curve name the backend knows
	 */
	public List<String> getSecurityLevels ();

	public Key generateKey (String securityLevel) throws UnsupportedCurveException;

	public byte[] keyToBin (Key key);

	public Key keyFromPublicBin (byte[] bin) throws ValidationException;

	public Key keyFromPrivateBin (byte[] bin) throws ValidationException;

	public boolean isValidPublicBin (byte[] bin);

	public boolean isValidPrivateBin (byte[] bin);

	public String keyToPem (Key key);

	public Key keyFromPublicPem (String pem) throws ValidationException;

	public Key keyFromPrivatePem (String pem) throws ValidationException;

	public boolean isValidPublicPem (String pem);

	public boolean isValidPrivatePem (String pem);

	public int getSignatureLength (Key key);

	public byte[] createSignature (Key key, byte[] digest) throws ValidationException;

	public SignatureVerdict checkSignature (Key key, byte[] digest, byte[] signature);

	public boolean isValidSignature (Key key, byte[] digest, byte[] signature);
}
