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
import java.security.SecureRandom;

import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECNamedDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.util.Arrays;

public class ECKeyPair implements Key
{
	private static final SecureRandom secureRandom = new SecureRandom ();

	private final ECNamedDomainParameters domain;
	private final BigInteger priv;
	private final byte[] pub;

	public static ECKeyPair createNew (String securityLevel) throws UnsupportedCurveException
	{
		ECNamedDomainParameters domain = Curves.getDomain (securityLevel);
		ECKeyPairGenerator generator = new ECKeyPairGenerator ();
		ECKeyGenerationParameters keygenParams = new ECKeyGenerationParameters (domain, secureRandom);
		generator.init (keygenParams);
		AsymmetricCipherKeyPair keypair = generator.generateKeyPair ();
		ECPrivateKeyParameters privParams = (ECPrivateKeyParameters) keypair.getPrivate ();
		ECPublicKeyParameters pubParams = (ECPublicKeyParameters) keypair.getPublic ();
		return new ECKeyPair (domain, privParams.getD (), pubParams.getQ ().getEncoded (false));
	}

	private ECKeyPair (ECNamedDomainParameters domain, BigInteger priv, byte[] pub)
	{
		this.domain = domain;
		this.priv = priv;
		this.pub = pub;
	}

	public ECKeyPair (ECNamedDomainParameters domain, BigInteger priv) throws ValidationException
	{
		if ( priv.signum () <= 0 || priv.compareTo (domain.getN ()) >= 0 )
		{
			throw new ValidationException ("Invalid private key");
		}
		this.domain = domain;
		this.priv = priv;
		pub = domain.getG ().multiply (priv).normalize ().getEncoded (false);
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
		return priv;
	}

	@Override
	public boolean hasPrivate ()
	{
		return true;
	}

	@Override
	public Key getReadOnly ()
	{
		return new ECPublicKey (domain, domain.getCurve ().decodePoint (pub));
	}

	@Override
	public BigInteger[] sign (byte[] digest) throws ValidationException
	{
		if ( digest == null || digest.length == 0 )
		{
			throw new ValidationException ("Nothing to sign");
		}
		ECDSASigner signer = new ECDSASigner (new HMacDSAKCalculator (new SHA256Digest ()));
		signer.init (true, new ECPrivateKeyParameters (priv, domain));
		return signer.generateSignature (digest);
	}

	@Override
	public boolean verify (byte[] digest, BigInteger r, BigInteger s)
	{
		return verify (domain, pub, digest, r, s);
	}

	static boolean verify (ECNamedDomainParameters domain, byte[] pub, byte[] digest, BigInteger r, BigInteger s)
	{
		ECDSASigner signer = new ECDSASigner ();
		signer.init (false, new ECPublicKeyParameters (domain.getCurve ().decodePoint (pub), domain));
		return signer.verifySignature (digest, r, s);
	}

	@Override
	public String toString ()
	{
		return "ECKeyPair[" + getCurveName () + "]";
	}
}
