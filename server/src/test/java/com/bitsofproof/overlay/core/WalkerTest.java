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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.bitsofproof.overlay.common.Crypto;
import com.bitsofproof.overlay.common.ECCrypto;
import com.bitsofproof.overlay.common.Hash;
import com.bitsofproof.overlay.common.Key;
import com.bitsofproof.overlay.common.NoCrypto;
import com.bitsofproof.overlay.common.ValidationException;

public class WalkerTest
{
	private static final long NOW = 1380000000000L;
	private static final String CID = "8164f55c2f828738fa779570e4605a81fec95c9d";

	private static class RecordingTransport implements WalkTransport
	{
		final List<Address> destinations = new ArrayList<Address> ();
		final List<IntroductionRequest> requests = new ArrayList<IntroductionRequest> ();
		final List<IntroductionResponse> responses = new ArrayList<IntroductionResponse> ();
		final List<byte[]> signatures = new ArrayList<byte[]> ();

		@Override
		public void sendIntroductionRequest (Address destination, IntroductionRequest request, byte[] signature)
		{
			destinations.add (destination);
			requests.add (request);
			signatures.add (signature);
		}

		@Override
		public void sendIntroductionResponse (Address destination, IntroductionResponse response, byte[] signature)
		{
			destinations.add (destination);
			responses.add (response);
			signatures.add (signature);
		}
	}

	private final Crypto crypto = new ECCrypto ();

	private final Address aWan = new Address ("81.0.0.1", 7001);
	private final Address bWan = new Address ("82.0.0.2", 7002);
	private final Community aCommunity = new Community (CID);
	private final Community bCommunity = new TrackerCommunity (CID);
	private final RecordingTransport aTransport = new RecordingTransport ();
	private final RecordingTransport bTransport = new RecordingTransport ();
	private Walker a;
	private Walker b;

	private Walker walker (Crypto crypto, Community community, RecordingTransport transport, Address wan) throws ValidationException
	{
		Walker walker = new Walker ();
		walker.setCrypto (crypto);
		walker.setKey (crypto.generateKey ("very-low"));
		walker.setCommunities (Arrays.asList (community));
		walker.setTransport (transport);
		walker.setLanAddress (new Address ("192.168.0.1", wan.getPort ()));
		walker.setWanAddress (wan);
		return walker;
	}

	@Before
	public void init () throws ValidationException
	{
		Bootstrap.setEnabled (true);
		a = walker (crypto, aCommunity, aTransport, aWan);
		b = walker (crypto, bCommunity, bTransport, bWan);
	}

	@Test
	public void stepWalksToBootstrap () throws ValidationException
	{
		Bootstrap bootstrap = new Bootstrap (Arrays.asList (new Address ("seed.example.org", 6421)));
		bootstrap.setHostResolver (new HostResolver ()
		{
			@Override
			public InetAddress resolve (String host) throws UnknownHostException
			{
				return InetAddress.getByAddress (host, new byte[] { 82, 0, 0, 2 });
			}
		});
		try
		{
			assertNull (a.takeStep (aCommunity, NOW));
			a.setBootstrap (bootstrap);
			assertNull (a.takeStep (aCommunity, NOW));

			assertTrue (bootstrap.resolve ());
			Candidate target = a.takeStep (aCommunity, NOW);
			assertNotNull (target);
			assertTrue (target.isBootstrap ());
			assertEquals (new Address ("82.0.0.2", 6421), target.getAddress ());
			assertTrue (target.isWalkPending (aCommunity, NOW + 1));

			assertEquals (1, aTransport.requests.size ());
			IntroductionRequest request = aTransport.requests.get (0);
			assertEquals (target.getAddress (), aTransport.destinations.get (0));
			assertEquals (CID, request.getCid ());
			assertEquals (aWan, request.getSourceWan ());
			Key sender = crypto.keyFromPublicBin (request.getMemberKey ());
			assertTrue (crypto.isValidSignature (sender, Hash.sha256 (request.toByteArray ()), aTransport.signatures.get (0)));

			// the seed is still waiting for its answer
			assertNull (a.takeStep (aCommunity, NOW + 1000));
		}
		finally
		{
			bootstrap.shutdown ();
		}
	}

	private static Bootstrap seedAt (final byte[] ip)
	{
		Bootstrap bootstrap = new Bootstrap (Arrays.asList (new Address ("seed.example.org", 6421)));
		bootstrap.setHostResolver (new HostResolver ()
		{
			@Override
			public InetAddress resolve (String host) throws UnknownHostException
			{
				return InetAddress.getByAddress (host, ip);
			}
		});
		return bootstrap;
	}

	@Test
	public void seedHeardBeforeStepStaysBootstrap () throws ValidationException
	{
		Address seedAddress = new Address ("82.0.0.9", 6421);
		Bootstrap bootstrap = seedAt (new byte[] { 82, 0, 0, 9 });
		try
		{
			b.setBootstrap (bootstrap);
			assertTrue (bootstrap.resolve ());

			// the seed peer contacts b before b ever stepped
			RecordingTransport seedTransport = new RecordingTransport ();
			Community seedCommunity = new Community (CID);
			Walker seed = walker (crypto, seedCommunity, seedTransport, seedAddress);
			seedCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
			seed.takeStep (seedCommunity, NOW);
			assertTrue (b.onIntroductionRequest (seedAddress, seedTransport.requests.get (0), seedTransport.signatures.get (0), NOW));

			Candidate known = bCommunity.getRegistry ().getCandidate (seedAddress);
			assertTrue (known.isBootstrap ());
			assertEquals (Candidate.Category.STUMBLE, known.getCategory (bCommunity, NOW));

			b.takeStep (bCommunity, NOW + 1);
			assertEquals (1, bCommunity.getRegistry ().size ());

			aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
			a.takeStep (aCommunity, NOW + 2);
			assertTrue (b.onIntroductionRequest (aWan, aTransport.requests.get (0), aTransport.signatures.get (0), NOW + 2));
			IntroductionResponse response = bTransport.responses.get (bTransport.responses.size () - 1);
			assertEquals (aWan, response.getDestination ());
			assertFalse (response.hasIntroduction ());
			assertTrue (bCommunity.yieldIntroduceCandidates (bCommunity.getRegistry ().getCandidate (aWan)).isEmpty ());
		}
		finally
		{
			bootstrap.shutdown ();
		}
	}

	@Test
	public void introducedSeedStaysBootstrap () throws ValidationException
	{
		Address seedAddress = new Address ("82.0.0.9", 6421);
		Bootstrap bootstrap = seedAt (new byte[] { 82, 0, 0, 9 });
		try
		{
			a.setBootstrap (bootstrap);
			assertTrue (bootstrap.resolve ());
			aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
			assertNotNull (a.takeStep (aCommunity, NOW));
			IntroductionRequest request = aTransport.requests.get (0);

			IntroductionResponse response =
					new IntroductionResponse (CID, crypto.keyToBin (b.getKey ().getReadOnly ()), aWan, new Address ("192.168.0.1", 7002), bWan,
							ConnectionType.UNKNOWN, request.getIdentifier (), new Address ("10.0.0.9", 6421), seedAddress);
			byte[] signature = crypto.createSignature (b.getKey (), Hash.sha256 (response.toByteArray ()));
			assertTrue (a.onIntroductionResponse (bWan, response, signature, NOW + 100));

			Candidate introduced = aCommunity.getRegistry ().getCandidate (seedAddress);
			assertTrue (introduced.isBootstrap ());
			assertEquals (Candidate.Category.INTRO, introduced.getCategory (aCommunity, NOW + 100));

			a.takeStep (aCommunity, NOW + 200);
			int atSeed = 0;
			for ( Candidate c : aCommunity.getRegistry ().getCandidates () )
			{
				if ( c.getAddress ().equals (seedAddress) )
				{
					++atSeed;
				}
			}
			assertEquals (1, atSeed);
		}
		finally
		{
			bootstrap.shutdown ();
		}
	}

	@Test
	public void requestIsAnsweredWithIntroduction () throws ValidationException
	{
		Address x = new Address ("83.0.0.3", 7003);
		bCommunity.createCandidate (x, false, new Address ("10.0.0.3", 7003), x, ConnectionType.UNKNOWN).stumble (bCommunity, NOW - 1000);
		aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));

		assertNotNull (a.takeStep (aCommunity, NOW));
		IntroductionRequest request = aTransport.requests.get (0);
		assertTrue (b.onIntroductionRequest (aWan, request, aTransport.signatures.get (0), NOW));

		Candidate requester = bCommunity.getRegistry ().getCandidate (aWan);
		assertNotNull (requester);
		assertEquals (Candidate.Category.STUMBLE, requester.getCategory (bCommunity, NOW));
		assertEquals (1, bTransport.responses.size ());
		IntroductionResponse response = bTransport.responses.get (0);
		assertEquals (aWan, bTransport.destinations.get (0));
		assertEquals (request.getIdentifier (), response.getIdentifier ());
		assertTrue (response.hasIntroduction ());
		assertEquals (x, response.getWanIntroduced ());

		assertTrue (a.onIntroductionResponse (bWan, response, bTransport.signatures.get (0), NOW + 100));
		Candidate responder = aCommunity.getRegistry ().getCandidate (bWan);
		assertEquals (Candidate.Category.WALK, responder.getCategory (aCommunity, NOW + 100));
		assertFalse (responder.isWalkPending (aCommunity, NOW + 100));
		Candidate introduced = aCommunity.getRegistry ().getCandidate (x);
		assertNotNull (introduced);
		assertEquals (Candidate.Category.INTRO, introduced.getCategory (aCommunity, NOW + 100));

		// the introduced peer is walked next, the seed waits for its delay
		assertSame (introduced, a.takeStep (aCommunity, NOW + 200));
	}

	@Test
	public void nobodyToIntroduce () throws ValidationException
	{
		aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
		a.takeStep (aCommunity, NOW);
		assertTrue (b.onIntroductionRequest (aWan, aTransport.requests.get (0), aTransport.signatures.get (0), NOW));
		assertFalse (bTransport.responses.get (0).hasIntroduction ());
		assertTrue (a.onIntroductionResponse (bWan, bTransport.responses.get (0), bTransport.signatures.get (0), NOW));
		assertEquals (1, aCommunity.getRegistry ().size ());
	}

	@Test
	public void badSignatureIsDropped () throws ValidationException
	{
		aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
		a.takeStep (aCommunity, NOW);
		byte[] signature = aTransport.signatures.get (0).clone ();
		signature[signature.length - 1] ^= 1;

		assertFalse (b.onIntroductionRequest (aWan, aTransport.requests.get (0), signature, NOW));
		assertFalse (b.onIntroductionRequest (aWan, aTransport.requests.get (0), new byte[0], NOW));
		assertEquals (0, bCommunity.getRegistry ().size ());
		assertTrue (bTransport.responses.isEmpty ());
	}

	@Test
	public void unknownCommunityIsDropped () throws ValidationException
	{
		Walker stranger = walker (crypto, new Community ("other"), bTransport, bWan);
		aCommunity.getRegistry ().add (new BootstrapCandidate (bWan));
		a.takeStep (aCommunity, NOW);
		assertFalse (stranger.onIntroductionRequest (aWan, aTransport.requests.get (0), aTransport.signatures.get (0), NOW));
		assertTrue (bTransport.responses.isEmpty ());
	}

	@Test
	public void noCryptoSignsAnything () throws ValidationException
	{
		RecordingTransport transport = new RecordingTransport ();
		Community community = new Community (CID);
		Walker walker = walker (new NoCrypto (), community, transport, aWan);
		community.getRegistry ().add (new BootstrapCandidate (bWan));
		walker.takeStep (community, NOW);
		byte[] signature = transport.signatures.get (0);
		assertEquals (42, signature.length);
		assertTrue (walker.onIntroductionRequest (bWan, transport.requests.get (0), new byte[] { 1, 2, 3 }, NOW));
	}

	@Test
	public void messageDecoding () throws ValidationException
	{
		IntroductionResponse response =
				new IntroductionResponse (CID, new byte[] { 1, 2, 3 }, aWan, new Address ("192.168.0.2", 7002), bWan, ConnectionType.SYMMETRIC_NAT, 4711,
						null, null);
		WalkMessage decoded = WalkMessage.fromByteArray (response.toByteArray ());
		assertTrue (decoded instanceof IntroductionResponse);
		assertEquals (ConnectionType.SYMMETRIC_NAT, decoded.getConnectionType ());
		assertEquals (4711, decoded.getIdentifier ());
		assertArrayEquals (new byte[] { 1, 2, 3 }, decoded.getMemberKey ());
		assertFalse (((IntroductionResponse) decoded).hasIntroduction ());
		assertArrayEquals (response.toByteArray (), decoded.toByteArray ());

		byte[] bytes = response.toByteArray ();
		byte[] truncated = Arrays.copyOf (bytes, bytes.length - 1);
		try
		{
			WalkMessage.fromByteArray (truncated);
			fail ("truncated message accepted");
		}
		catch ( ValidationException e )
		{
			// expected
		}
	}

	@Test
	public void startAndStop () throws ValidationException
	{
		Walker walker = new Walker ();
		walker.setCrypto (new NoCrypto ());
		walker.setSecurityLevel ("very-low");
		walker.setTransport (new RecordingTransport ());
		walker.setInterval (60000);
		walker.start ();
		assertTrue (walker.isRunning ());
		assertEquals ("sect163k1", walker.getKey ().getCurveName ());
		assertEquals (40, walker.getMemberId ().length ());
		walker.start ();
		walker.stop ();
		assertFalse (walker.isRunning ());
		walker.stop ();
	}
}
