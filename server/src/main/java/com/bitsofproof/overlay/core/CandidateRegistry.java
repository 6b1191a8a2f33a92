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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * The candidates of one community, in the order they became known. Not synchronized; owned by the thread driving the community.
 */
public class CandidateRegistry
{
	private static final Logger log = LoggerFactory.getLogger (CandidateRegistry.class);

	private final Community community;
	private final Set<Candidate> candidates = new LinkedHashSet<Candidate> ();

	CandidateRegistry (Community community)
	{
		this.community = community;
	}

	public boolean add (Candidate candidate)
	{
		return candidates.add (candidate);
	}

	public boolean remove (Candidate candidate)
	{
		return candidates.remove (candidate);
	}

	public boolean contains (Candidate candidate)
	{
		return candidates.contains (candidate);
	}

	public int size ()
	{
		return candidates.size ();
	}

	public List<Candidate> getCandidates ()
	{
		return ImmutableList.copyOf (candidates);
	}

	/**
	 * @return the first candidate known under this wire address, or null
	 */
	public Candidate getCandidate (Address address)
	{
		for ( Candidate c : candidates )
		{
			if ( c.getAddress ().equals (address) )
			{
				return c;
			}
		}
		return null;
	}

	/**
	 * Folds duplicates of the reference into it and drops them from the registry. A candidate is a duplicate if it uses the same wire address, or if
	 * it shares the WAN host with the reference while some candidate of that WAN host, the reference included, is behind a symmetric NAT. Ports are
	 * meaningless behind a symmetric NAT, so the WAN host alone identifies the peer there.
	 *
	 * @return the candidates folded into the reference
	 */
	public List<Candidate> filterDuplicate (Candidate reference)
	{
		List<Candidate> folded = new ArrayList<Candidate> ();
		List<Candidate> sameWanHost = new ArrayList<Candidate> ();
		boolean symmetric = reference.getConnectionType () == ConnectionType.SYMMETRIC_NAT;
		String wanHost = reference.getWanAddress ().getHost ();

		for ( Candidate c : candidates )
		{
			if ( c == reference )
			{
				continue;
			}
			if ( c.getAddress ().equals (reference.getAddress ()) )
			{
				folded.add (c);
			}
			else if ( c.getWanAddress ().getHost ().equals (wanHost) )
			{
				sameWanHost.add (c);
				symmetric |= c.getConnectionType () == ConnectionType.SYMMETRIC_NAT;
			}
		}
		if ( symmetric )
		{
			folded.addAll (sameWanHost);
		}
		else if ( !sameWanHost.isEmpty () )
		{
			log.trace ("Not merging " + sameWanHost.size () + " candidates sharing WAN host " + wanHost + " with " + reference + ", no symmetric NAT");
		}

		Iterator<Candidate> i = candidates.iterator ();
		while ( i.hasNext () )
		{
			Candidate c = i.next ();
			if ( c != reference && folded.contains (c) )
			{
				reference.merge (c);
				i.remove ();
			}
		}
		candidates.add (reference);

		if ( !folded.isEmpty () )
		{
			log.debug ("Merged " + folded.size () + " duplicates into " + reference + " in " + community);
		}
		return folded;
	}

	/**
	 * Candidates that may be introduced to the requester: everyone with some activity in this community except the requester and bootstrap
	 * candidates.
	 */
	List<Candidate> getIntroductionPool (Candidate requester)
	{
		List<Candidate> pool = new ArrayList<Candidate> ();
		for ( Candidate c : candidates )
		{
			if ( c == requester || c.isBootstrap () || c.getAddress ().equals (requester.getAddress ()) )
			{
				continue;
			}
			Candidate.Activity a = c.getActivity (community);
			if ( a != null && a.getLastSequence () > 0 )
			{
				pool.add (c);
			}
		}
		return pool;
	}
}
