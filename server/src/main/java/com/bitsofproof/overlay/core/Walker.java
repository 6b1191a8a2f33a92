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

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bitsofproof.overlay.common.ByteUtils;
import com.bitsofproof.overlay.common.Crypto;
import com.bitsofproof.overlay.common.Hash;
import com.bitsofproof.overlay.common.Key;
import com.bitsofproof.overlay.common.ValidationException;
import com.google.common.base.Preconditions;

/**
 * Drives the random walk of every community: each step sends one signed introduction request to the candidate walked least recently, incoming
 * requests are answered with an introduction, incoming responses update the registry.
 *
 * Steps and message handlers synchronize on the walker, so the communities see a single thread at a time.
 */
public class Walker implements Runnable
{
	private static final Logger log = LoggerFactory.getLogger (Walker.class);

	public static final long DEFAULT_INTERVAL = 5000;
	/** a walk target has this long to answer (ms) */
	public static final long WALK_TIMEOUT = 10500;

	private Crypto crypto;
	private Key key;
	private String securityLevel = "medium";
	private Bootstrap bootstrap;
	private List<Community> communities = new ArrayList<Community> ();
	private WalkTransport transport;
	private Address lanAddress = new Address ("0.0.0.0", 0);
	private Address wanAddress = new Address ("0.0.0.0", 0);
	private ConnectionType connectionType = ConnectionType.UNKNOWN;
	private long interval = DEFAULT_INTERVAL;

	private final Random random = new SecureRandom ();
	private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor (new DaemonThreadFactory ("walker"));
	private ScheduledFuture<?> task;

	/**
	 * Starts walking every interval. Generates a key of the configured security level if none was set.
	 */
	public synchronized void start () throws ValidationException
	{
		Preconditions.checkState (crypto != null && transport != null, "crypto and transport are required");
		if ( task != null )
		{
			return;
		}
		if ( key == null )
		{
			key = crypto.generateKey (securityLevel);
			log.info ("Generated " + key.getCurveName () + " member key");
		}
		log.info ("Member " + getMemberId () + " walking " + communities.size () + " communities every " + interval + "ms");
		task = scheduler.scheduleWithFixedDelay (this, 0, interval, TimeUnit.MILLISECONDS);
	}

	public synchronized void stop ()
	{
		if ( task != null )
		{
			task.cancel (false);
			task = null;
			log.info ("Walker stopped");
		}
	}

	public synchronized boolean isRunning ()
	{
		return task != null;
	}

	@Override
	public void run ()
	{
		long now = System.currentTimeMillis ();
		for ( Community community : getCommunities () )
		{
			try
			{
				takeStep (community, now);
			}
			catch ( RuntimeException e )
			{
				log.error ("Walk step failed in " + community, e);
			}
		}
	}

	/**
	 * Sends one introduction request in the community.
	 *
	 * @return the walk target, or null if no candidate is eligible
	 */
	public synchronized Candidate takeStep (Community community, long now)
	{
		seed (community);
		Candidate target = community.getWalkCandidate (now);
		if ( target == null )
		{
			log.trace ("No walk candidate in " + community);
			return null;
		}
		target.walk (community, now, WALK_TIMEOUT);
		IntroductionRequest request =
				new IntroductionRequest (community.getCid (), crypto.keyToBin (key.getReadOnly ()), target.getAddress (), lanAddress, wanAddress,
						connectionType, random.nextInt (0x10000), true);
		byte[] signature = sign (request);
		if ( signature != null )
		{
			log.trace ("Walking to " + target + " in " + community);
			transport.sendIntroductionRequest (target.getAddress (), request, signature);
		}
		return target;
	}

	private void seed (Community community)
	{
		if ( bootstrap == null )
		{
			return;
		}
		for ( BootstrapCandidate b : bootstrap.getCandidates () )
		{
			registered (community, b.getAddress ());
		}
	}

	/**
	 * The candidate known under the address. A resolved seed peer is always known as its bootstrap candidate: ordinary candidates registered at its
	 * address before it was resolved are replaced and their activity carried over.
	 *
	 * @return null if neither the registry nor the bootstrap knows the address
	 */
	private Candidate registered (Community community, Address address)
	{
		Candidate existing = community.getRegistry ().getCandidate (address);
		if ( existing != null && existing.isBootstrap () )
		{
			return existing;
		}
		BootstrapCandidate seed = findSeed (address);
		if ( seed == null )
		{
			return existing;
		}
		CandidateRegistry registry = community.getRegistry ();
		for ( Candidate c : registry.getCandidates () )
		{
			if ( !c.isBootstrap () && c.getAddress ().equals (address) )
			{
				log.debug ("Seed peer " + address + " replaces " + c + " in " + community);
				seed.merge (c);
				registry.remove (c);
			}
		}
		registry.add (seed);
		return seed;
	}

	private BootstrapCandidate findSeed (Address address)
	{
		if ( bootstrap == null )
		{
			return null;
		}
		for ( BootstrapCandidate b : bootstrap.getCandidates () )
		{
			if ( b.getAddress ().equals (address) )
			{
				return b;
			}
		}
		return null;
	}

	/**
	 * A peer asks for an introduction. The sender becomes a stumble candidate and is introduced to the candidate that was active right before it.
	 *
	 * @return false if the message was dropped
	 */
	public synchronized boolean onIntroductionRequest (Address source, IntroductionRequest request, byte[] signature, long now)
	{
		Community community = getCommunity (request.getCid ());
		if ( community == null || !isAuthentic (request, signature) )
		{
			return false;
		}
		Candidate requester = candidateFor (community, source, request);
		requester.stumble (community, now);
		if ( !requester.isBootstrap () )
		{
			community.filterDuplicate (requester);
		}

		Candidate introduced = request.isAdvice () ? community.getIntroduceCandidate (requester) : null;
		IntroductionResponse response =
				new IntroductionResponse (community.getCid (), crypto.keyToBin (key.getReadOnly ()), source, lanAddress, wanAddress, connectionType,
						request.getIdentifier (), introduced == null ? null : introduced.getLanAddress (), introduced == null ? null
								: introduced.getWanAddress ());
		byte[] responseSignature = sign (response);
		if ( responseSignature != null )
		{
			log.trace ("Introducing " + introduced + " to " + requester + " in " + community);
			transport.sendIntroductionResponse (source, response, responseSignature);
		}
		return true;
	}

	/**
	 * The walk target answered. The target becomes a walk candidate, the peer it introduced an intro candidate.
	 *
	 * @return false if the message was dropped
	 */
	public synchronized boolean onIntroductionResponse (Address source, IntroductionResponse response, byte[] signature, long now)
	{
		Community community = getCommunity (response.getCid ());
		if ( community == null || !isAuthentic (response, signature) )
		{
			return false;
		}
		Candidate responder = candidateFor (community, source, response);
		responder.walkResponse (community, now);
		if ( !responder.isBootstrap () )
		{
			community.filterDuplicate (responder);
		}

		if ( response.hasIntroduction () )
		{
			// peers behind our own NAT are reached on their LAN address
			Address target =
					response.getWanIntroduced ().getHost ().equals (wanAddress.getHost ()) ? response.getLanIntroduced () : response.getWanIntroduced ();
			if ( !target.equals (lanAddress) && !target.equals (wanAddress) )
			{
				Candidate introduced = registered (community, target);
				if ( introduced == null )
				{
					introduced =
							community.createCandidate (target, false, response.getLanIntroduced (), response.getWanIntroduced (), ConnectionType.UNKNOWN);
				}
				introduced.intro (community, now);
			}
		}
		return true;
	}

	private Candidate candidateFor (Community community, Address source, WalkMessage message)
	{
		Candidate candidate = registered (community, source);
		if ( candidate == null )
		{
			return community.createCandidate (source, false, message.getSourceLan (), message.getSourceWan (), message.getConnectionType ());
		}
		if ( !candidate.isBootstrap ()
				&& (!candidate.getLanAddress ().equals (message.getSourceLan ()) || !candidate.getWanAddress ().equals (message.getSourceWan ()) || candidate
						.getConnectionType () != message.getConnectionType ()) )
		{
			candidate.update (message.getSourceLan (), message.getSourceWan (), message.getConnectionType ());
		}
		return candidate;
	}

	private boolean isAuthentic (WalkMessage message, byte[] signature)
	{
		Key sender;
		try
		{
			sender = crypto.keyFromPublicBin (message.getMemberKey ());
		}
		catch ( ValidationException e )
		{
			log.debug ("Dropping " + message + ": " + e.getMessage ());
			return false;
		}
		if ( !crypto.isValidSignature (sender, Hash.sha256 (message.toByteArray ()), signature) )
		{
			log.debug ("Dropping " + message + ": bad signature");
			return false;
		}
		return true;
	}

	private byte[] sign (WalkMessage message)
	{
		try
		{
			return crypto.createSignature (key, Hash.sha256 (message.toByteArray ()));
		}
		catch ( ValidationException e )
		{
			log.error ("Can not sign " + message, e);
			return null;
		}
	}

	private Community getCommunity (String cid)
	{
		for ( Community c : communities )
		{
			if ( c.getCid ().equals (cid) )
			{
				return c;
			}
		}
		log.trace ("Message for unknown community " + cid);
		return null;
	}

	public synchronized List<Community> getCommunities ()
	{
		return new ArrayList<Community> (communities);
	}

	public synchronized void setCommunities (List<Community> communities)
	{
		this.communities = new ArrayList<Community> (communities);
	}

	public void setCrypto (Crypto crypto)
	{
		this.crypto = crypto;
	}

	/**
	 * @return hex of the SHA-1 over the binary public key, the identity other peers know us by
	 */
	public synchronized String getMemberId ()
	{
		return ByteUtils.toHex (Hash.keyHash (crypto.keyToBin (key.getReadOnly ())));
	}

	public synchronized Key getKey ()
	{
		return key;
	}

	public synchronized void setKey (Key key)
	{
		Preconditions.checkArgument (key.hasPrivate (), "walker key must be able to sign");
		this.key = key;
	}

	public void setSecurityLevel (String securityLevel)
	{
		this.securityLevel = securityLevel;
	}

	public synchronized Bootstrap getBootstrap ()
	{
		return bootstrap;
	}

	public synchronized void setBootstrap (Bootstrap bootstrap)
	{
		this.bootstrap = bootstrap;
	}

	public void setTransport (WalkTransport transport)
	{
		this.transport = transport;
	}

	public synchronized void setLanAddress (Address lanAddress)
	{
		this.lanAddress = Preconditions.checkNotNull (lanAddress);
	}

	public synchronized void setWanAddress (Address wanAddress)
	{
		this.wanAddress = Preconditions.checkNotNull (wanAddress);
	}

	public synchronized void setConnectionType (ConnectionType connectionType)
	{
		this.connectionType = Preconditions.checkNotNull (connectionType);
	}

	public long getInterval ()
	{
		return interval;
	}

	public void setInterval (long interval)
	{
		Preconditions.checkArgument (interval > 0, "interval must be positive");
		this.interval = interval;
	}
}
