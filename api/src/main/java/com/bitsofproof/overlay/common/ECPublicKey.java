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

import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.crypto.params.ECNamedDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;

public class ECPublicKey implements Key
{
	private final ECNamedDomainParameters domain;
	private final byte[] pub;

	public ECPublicKey (ECNamedDomainParameters domain, ECPoint q)
	{
		this.domain = domain;
		this.pub = q.normalize ().getEncoded (false);
	}

	public ECPublicKey (ECNamedDomainParameters domain, byte[] encoded) throws ValidationException
	{
		ECPoint q;
		try
		{
			q = domain.getCurve ().decodePoint (encoded);
		}
		catch ( IllegalArgumentException e )
		{
			throw new ValidationException ("Invalid public point", e);
		}
		if ( q.isInfinity () || !q.isValid () )
		{
			throw new ValidationException ("Public point not on curve");
		}
		this.domain = domain;
		this.pub = q.normalize ().getEncoded (false);
	}

	@Override
	public String getCurveName ()
	{
		return ECNamedCurveTable.getName (domain.getName ());
	}

	@Override
	public ECNamedDomainParameters getDomain ()
	{
		return domain;
	}

	@Override
	public byte[] getPublic ()
	{
		return Arrays.clone (pub);
	}

	@Override
	public BigInteger getPrivate ()
	{
		return null;
	}

	@Override
	public boolean hasPrivate ()
	{
		return false;
	}

	@Override
	public Key getReadOnly ()
	{
		return this;
	}

	@Override
	public BigInteger[] sign (byte[] digest) throws ValidationException
	{
		throw new ValidationException ("Can not sign with public key");
	}

	@Override
	public boolean verify (byte[] digest, BigInteger r, BigInteger s)
	{
		return ECKeyPair.verify (domain, pub, digest, r, s);
	}

	@Override
	public String toString ()
	{
		return "ECPublicKey[" + getCurveName () + "]";
	}
}
