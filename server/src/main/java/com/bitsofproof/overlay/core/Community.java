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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * One overlay community and the candidates it knows.
 *
 * Introductions rotate through the community instead of always naming the same well known peer: a requester is introduced to the peer that was active
 * last before the requester itself. Every peer that shows up this way ends up introduced to the next one, which keeps the overlay from growing hubs.
 */
public class Community
{
	private static final Logger log = LoggerFactory.getLogger (Community.class);

	private final String cid;
	private final CandidateRegistry registry;
	private long sequence;

	public Community (String cid)
	{
		this.cid = Preconditions.checkNotNull (cid, "cid");
		this.registry = new CandidateRegistry (this);
	}

	public String getCid ()
	{
		return cid;
	}

	public CandidateRegistry getRegistry ()
	{
		return registry;
	}

	/**
	 * Events are numbered in the order they are delivered to this community.
	 */
	long nextSequence ()
	{
		return ++sequence;
	}

	/**
	 * Creates and registers a new candidate. A candidate already known under the same address is left alone; {@link #filterDuplicate(Candidate)}
	 * merges the two later.
	 */
	public Candidate createCandidate (Address address, boolean bootstrap, Address lanAddress, Address wanAddress, ConnectionType connectionType)
	{
		Candidate candidate = new Candidate (address, bootstrap, lanAddress, wanAddress, connectionType);
		registry.add (candidate);
		log.trace ("New candidate " + candidate + " at " + address + " in " + this);
		return candidate;
	}

	public List<Candidate> filterDuplicate (Candidate reference)
	{
		return registry.filterDuplicate (reference);
	}

	/**
	 * Candidates to introduce to the requester, best first. Computed from the current state on every call; never contains the requester or a bootstrap
	 * candidate.
	 */
	public List<Candidate> yieldIntroduceCandidates (Candidate requester)
	{
		Preconditions.checkNotNull (requester, "requester");
		return orderIntroductions (requester, registry.getIntroductionPool (requester));
	}

	/**
	 * @return the candidate to introduce to the requester, or null if there is none yet
	 */
	public Candidate getIntroduceCandidate (Candidate requester)
	{
		List<Candidate> candidates = yieldIntroduceCandidates (requester);
		return candidates.isEmpty () ? null : candidates.get (0);
	}

	/**
	 * Candidates active strictly before the requester's last stumble, walk or walk response, most recent first. Equal times are ordered by delivery.
	 */
	protected List<Candidate> orderIntroductions (Candidate requester, List<Candidate> pool)
	{
		final Candidate.Activity mine = requester.getActivity (this);
		List<Candidate> before = new ArrayList<Candidate> ();
		for ( Candidate c : pool )
		{
			if ( mine == null || compareActivity (c.getActivity (this), mine) < 0 )
			{
				before.add (c);
			}
		}
		Collections.sort (before, new Comparator<Candidate> ()
		{
			@Override
			public int compare (Candidate a, Candidate b)
			{
				return compareActivity (b.getActivity (Community.this), a.getActivity (Community.this));
			}
		});
		return before;
	}

	private static int compareActivity (Candidate.Activity a, Candidate.Activity b)
	{
		int c = Long.compare (a.getLastActive (), b.getLastActive ());
		if ( c != 0 )
		{
			return c;
		}
		return Long.compare (a.getLastSequence (), b.getLastSequence ());
	}

	/**
	 * Next candidate to walk to: the eligible candidate walked least recently, bootstrap candidates only if no other is eligible.
	 *
	 * @return null if nobody is eligible
	 */
	public Candidate getWalkCandidate (long now)
	{
		Candidate best = null;
		Candidate bestBootstrap = null;
		for ( Candidate c : registry.getCandidates () )
		{
			if ( !c.isEligibleForWalk (this, now) )
			{
				continue;
			}
			if ( c.isBootstrap () )
			{
				if ( bestBootstrap == null || c.getLastWalk (this) < bestBootstrap.getLastWalk (this) )
				{
					bestBootstrap = c;
				}
			}
			else if ( best == null || c.getLastWalk (this) < best.getLastWalk (this) )
			{
				best = c;
			}
		}
		return best != null ? best : bestBootstrap;
	}

	@Override
	public String toString ()
	{
		return getClass ().getSimpleName () + "[" + cid + "]";
	}
}
