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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECNamedDomainParameters;

/**
 * Security levels and the named curves behind them.
 *
 * The four default levels are
 * <ul>
 * <li>very-low: sect163k1, 42 byte signatures</li>
 * <li>low: sect233k1, 60 byte signatures</li>
 * <li>medium: sect409k1, 104 byte signatures</li>
 * <li>high: sect571r1, 144 byte signatures</li>
 * </ul>
 * Every other curve of the BouncyCastle curve table is accepted under its own name.
 */
public final class Curves
{
	private static final Map<String, String> levels = new LinkedHashMap<String, String> ();
	static
	{
		levels.put ("very-low", "sect163k1");
		levels.put ("low", "sect233k1");
		levels.put ("medium", "sect409k1");
		levels.put ("high", "sect571r1");
	}

	private static final Map<ASN1ObjectIdentifier, ECNamedDomainParameters> domains = new ConcurrentHashMap<ASN1ObjectIdentifier, ECNamedDomainParameters> ();

	private Curves ()
	{
	}

	public static List<String> getSecurityLevels ()
	{
		List<String> names = new ArrayList<String> ();
		@SuppressWarnings ("unchecked")
		Enumeration<String> e = ECNamedCurveTable.getNames ();
		while ( e.hasMoreElements () )
		{
			names.add (e.nextElement ());
		}
		Collections.sort (names);

		List<String> result = new ArrayList<String> (levels.keySet ());
		result.addAll (names);
		return result;
	}

	public static ECNamedDomainParameters getDomain (String securityLevel) throws UnsupportedCurveException
	{
		if ( securityLevel == null )
		{
			throw new UnsupportedCurveException (null);
		}
		String name = levels.containsKey (securityLevel) ? levels.get (securityLevel) : securityLevel;
		ASN1ObjectIdentifier oid;
		try
		{
			oid = ECNamedCurveTable.getOID (name);
		}
		catch ( IllegalArgumentException e )
		{
			oid = null;
		}
		if ( oid == null )
		{
			throw new UnsupportedCurveException (securityLevel);
		}
		return getDomain (oid);
	}

	public static ECNamedDomainParameters getDomain (ASN1ObjectIdentifier oid) throws UnsupportedCurveException
	{
		ECNamedDomainParameters domain = domains.get (oid);
		if ( domain == null )
		{
			X9ECParameters x9 = ECNamedCurveTable.getByOID (oid);
			if ( x9 == null )
			{
				throw new UnsupportedCurveException (oid.getId ());
			}
			domain = new ECNamedDomainParameters (oid, x9);
			domains.put (oid, domain);
		}
		return domain;
	}

	/**
	 * Number of bytes of one signature component on this curve, i.e. the field size rounded up to bytes.
	 */
	public static int getComponentLength (ECDomainParameters domain)
	{
		return (domain.getCurve ().getFieldSize () + 7) / 8;
	}
}
