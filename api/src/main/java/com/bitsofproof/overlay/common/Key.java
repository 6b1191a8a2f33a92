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

import java.math.BigInteger;

import org.bouncycastle.crypto.params.ECNamedDomainParameters;

/**
 * An elliptic curve key. Either public only ({@link ECPublicKey}) or a key pair ({@link ECKeyPair}). Keys never change once created.
 */
public interface Key
{
	/**
	 * @return the curve name as known to the curve table, e.g. sect233k1
	 */
	public String getCurveName ();

	public ECNamedDomainParameters getDomain ();

	/**
	 * @return uncompressed encoding of the public point
	 */
	public byte[] getPublic ();

	/**
	 * @return the private scalar, or null for a public key
	 */
	public BigInteger getPrivate ();

	public boolean hasPrivate ();

	public Key getReadOnly ();

	/**
	 * Raw DSA style signature of a digest.
	 *
	 * @return the scalar pair {r, s}
	 */
	public BigInteger[] sign (byte[] digest) throws ValidationException;

	public boolean verify (byte[] digest, BigInteger r, BigInteger s);
}
