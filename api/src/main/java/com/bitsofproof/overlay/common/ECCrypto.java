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

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.List;

import org.bouncycastle.asn1.ASN1BitString;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.DERBitString;
import org.bouncycastle.asn1.sec.ECPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X962Parameters;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.crypto.params.ECNamedDomainParameters;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elliptic curve implementation of {@link Crypto} on the BouncyCastle lightweight API.
 *
 * The binary form of a key is the base64 body of its PEM: an X.509 SubjectPublicKeyInfo for public keys (PEM type PUBLIC KEY) and a SEC1 ECPrivateKey
 * for key pairs (PEM type EC PRIVATE KEY). Curves are always referenced by name. Encrypted PEM is not supported.
 */
public class ECCrypto implements Crypto
{
	private static final Logger log = LoggerFactory.getLogger (ECCrypto.class);

	static final String PUBLIC_PEM = "PUBLIC KEY";
	static final String PRIVATE_PEM = "EC PRIVATE KEY";

	@Override
	public List<String> getSecurityLevels ()
	{
		return Curves.getSecurityLevels ();
	}

	@Override
	public Key generateKey (String securityLevel) throws UnsupportedCurveException
	{
		return ECKeyPair.createNew (securityLevel);
	}

	@Override
	public byte[] keyToBin (Key key)
	{
		try
		{
			if ( key.hasPrivate () )
			{
				ECNamedDomainParameters domain = key.getDomain ();
				ECPrivateKey sec1 =
						new ECPrivateKey (domain.getN ().bitLength (), key.getPrivate (), new DERBitString (key.getPublic ()), new X962Parameters (
								domain.getName ()));
				return sec1.getEncoded ();
			}
			AlgorithmIdentifier algorithm = new AlgorithmIdentifier (X9ObjectIdentifiers.id_ecPublicKey, new X962Parameters (key.getDomain ().getName ()));
			return new SubjectPublicKeyInfo (algorithm, key.getPublic ()).getEncoded ();
		}
		catch ( IOException e )
		{
			// DER encoding into memory
			throw new IllegalStateException (e);
		}
	}

	@Override
	public Key keyFromPublicBin (byte[] bin) throws ValidationException
	{
		if ( bin == null || bin.length == 0 )
		{
			throw new ValidationException ("Empty public key");
		}
		SubjectPublicKeyInfo info;
		ECNamedDomainParameters domain;
		byte[] point;
		try
		{
			info = SubjectPublicKeyInfo.getInstance (ASN1Primitive.fromByteArray (bin));
			if ( !X9ObjectIdentifiers.id_ecPublicKey.equals (info.getAlgorithm ().getAlgorithm ()) )
			{
				throw new ValidationException ("Not an elliptic curve public key " + info.getAlgorithm ().getAlgorithm ());
			}
			domain = namedDomain (info.getAlgorithm ().getParameters ());
			point = info.getPublicKeyData ().getOctets ();
		}
		catch ( IOException e )
		{
			throw new ValidationException ("Malformed public key", e);
		}
		catch ( RuntimeException e )
		{
			// the ASN.1 layer reports structural errors unchecked
			throw new ValidationException ("Malformed public key", e);
		}
		return new ECPublicKey (domain, point);
	}

	@Override
	public Key keyFromPrivateBin (byte[] bin) throws ValidationException
	{
		if ( bin == null || bin.length == 0 )
		{
			throw new ValidationException ("Empty private key");
		}
		ECNamedDomainParameters domain;
		ECKeyPair key;
		byte[] embedded = null;
		try
		{
			ECPrivateKey sec1 = ECPrivateKey.getInstance (ASN1Primitive.fromByteArray (bin));
			domain = namedDomain (sec1.getParametersObject ());
			// getKey casts the second element unchecked
			key = new ECKeyPair (domain, sec1.getKey ());
			ASN1BitString publicKey = sec1.getPublicKey ();
			if ( publicKey != null )
			{
				embedded = publicKey.getOctets ();
			}
		}
		catch ( IOException e )
		{
			throw new ValidationException ("Malformed private key", e);
		}
		catch ( RuntimeException e )
		{
			throw new ValidationException ("Malformed private key", e);
		}
		if ( embedded != null )
		{
			Key claimed = new ECPublicKey (domain, embedded);
			if ( !Arrays.areEqual (claimed.getPublic (), key.getPublic ()) )
			{
				throw new ValidationException ("Public key does not match private key");
			}
		}
		return key;
	}

	private static ECNamedDomainParameters namedDomain (Object parameters) throws ValidationException
	{
		if ( parameters == null )
		{
			throw new ValidationException ("Missing curve parameters");
		}
		X962Parameters x962 = X962Parameters.getInstance (parameters);
		if ( !x962.isNamedCurve () )
		{
			throw new ValidationException ("Only named curves are supported");
		}
		return Curves.getDomain (ASN1ObjectIdentifier.getInstance (x962.getParameters ()));
	}

	@Override
	public boolean isValidPublicBin (byte[] bin)
	{
		try
		{
			keyFromPublicBin (bin);
			return true;
		}
		catch ( ValidationException e )
		{
			log.trace ("Invalid public key: " + e.getMessage ());
			return false;
		}
	}

	@Override
	public boolean isValidPrivateBin (byte[] bin)
	{
		try
		{
			keyFromPrivateBin (bin);
			return true;
		}
		catch ( ValidationException e )
		{
			log.trace ("Invalid private key: " + e.getMessage ());
			return false;
		}
	}

	@Override
	public String keyToPem (Key key)
	{
		StringWriter text = new StringWriter ();
		PemWriter writer = new PemWriter (text);
		try
		{
			writer.writeObject (new PemObject (key.hasPrivate () ? PRIVATE_PEM : PUBLIC_PEM, keyToBin (key)));
			writer.close ();
		}
		catch ( IOException e )
		{
			throw new IllegalStateException (e);
		}
		return text.toString ();
	}

	@Override
	public Key keyFromPublicPem (String pem) throws ValidationException
	{
		return keyFromPublicBin (pemToBin (pem, PUBLIC_PEM));
	}

	@Override
	public Key keyFromPrivatePem (String pem) throws ValidationException
	{
		return keyFromPrivateBin (pemToBin (pem, PRIVATE_PEM));
	}

	/**
	 * Strips the armor of a single PEM object of the expected type and returns the decoded body.
	 */
	public byte[] pemToBin (String pem, String expectedType) throws ValidationException
	{
		if ( pem == null )
		{
			throw new ValidationException ("No PEM");
		}
		PemReader reader = new PemReader (new StringReader (pem));
		try
		{
			PemObject object = reader.readPemObject ();
			if ( object == null )
			{
				throw new ValidationException ("No PEM object found");
			}
			if ( !expectedType.equals (object.getType ()) )
			{
				throw new ValidationException ("Expected " + expectedType + " but found " + object.getType ());
			}
			return object.getContent ();
		}
		catch ( IOException e )
		{
			throw new ValidationException ("Malformed PEM", e);
		}
		catch ( RuntimeException e )
		{
			// base64 decoder
			throw new ValidationException ("Malformed PEM", e);
		}
		finally
		{
			try
			{
				reader.close ();
			}
			catch ( IOException e )
			{
				log.trace ("Can not close PEM reader", e);
			}
		}
	}

	@Override
	public boolean isValidPublicPem (String pem)
	{
		try
		{
			keyFromPublicPem (pem);
			return true;
		}
		catch ( ValidationException e )
		{
			log.trace ("Invalid public PEM: " + e.getMessage ());
			return false;
		}
	}

	@Override
	public boolean isValidPrivatePem (String pem)
	{
		try
		{
			keyFromPrivatePem (pem);
			return true;
		}
		catch ( ValidationException e )
		{
			log.trace ("Invalid private PEM: " + e.getMessage ());
			return false;
		}
	}

	@Override
	public int getSignatureLength (Key key)
	{
		return 2 * Curves.getComponentLength (key.getDomain ());
	}

	@Override
	public byte[] createSignature (Key key, byte[] digest) throws ValidationException
	{
		int length = Curves.getComponentLength (key.getDomain ());
		BigInteger[] rs = key.sign (digest);
		byte[] signature = new byte[2 * length];
		toFixedWidth (rs[0], signature, 0, length);
		toFixedWidth (rs[1], signature, length, length);
		return signature;
	}

	/**
	 * Writes the magnitude of value right aligned into length bytes. Shorter values are left padded with zeros, longer ones lose their leading bytes.
	 */
	static void toFixedWidth (BigInteger value, byte[] into, int offset, int length)
	{
		byte[] magnitude = BigIntegers.asUnsignedByteArray (value);
		int n = Math.min (length, magnitude.length);
		System.arraycopy (magnitude, magnitude.length - n, into, offset + length - n, n);
	}

	/**
	 * Minimal big-endian two's complement encoding of a positive integer stored in a fixed width field: leading zero bytes removed, a single zero byte
	 * put back if the top bit is set.
	 *
	 * @return the encoding, or null if the field holds only zeros
	 */
	static byte[] toMinimalPositive (byte[] field, int offset, int length)
	{
		int start = offset;
		int end = offset + length;
		while ( start < end && field[start] == 0 )
		{
			++start;
		}
		if ( start == end )
		{
			return null;
		}
		boolean topBit = (field[start] & 0x80) != 0;
		byte[] minimal = new byte[end - start + (topBit ? 1 : 0)];
		System.arraycopy (field, start, minimal, topBit ? 1 : 0, end - start);
		return minimal;
	}

	@Override
	public SignatureVerdict checkSignature (Key key, byte[] digest, byte[] signature)
	{
		if ( signature == null || signature.length != getSignatureLength (key) )
		{
			return SignatureVerdict.MALFORMED_LENGTH;
		}
		if ( digest == null || digest.length == 0 )
		{
			return SignatureVerdict.REJECTED;
		}
		int length = signature.length / 2;
		byte[] r = toMinimalPositive (signature, 0, length);
		byte[] s = toMinimalPositive (signature, length, length);
		if ( r == null || s == null )
		{
			return SignatureVerdict.MALFORMED_SCALAR;
		}
		if ( key.verify (digest, new BigInteger (r), new BigInteger (s)) )
		{
			return SignatureVerdict.VALID;
		}
		return SignatureVerdict.REJECTED;
	}

	@Override
	public boolean isValidSignature (Key key, byte[] digest, byte[] signature)
	{
		SignatureVerdict verdict = checkSignature (key, digest, signature);
		if ( !verdict.isValid () )
		{
			log.trace ("Signature check failed: " + verdict);
		}
		return verdict.isValid ();
	}
}
