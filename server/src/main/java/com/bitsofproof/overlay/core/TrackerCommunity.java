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

/**
 * Community run by a tracker, a pure rendezvous node that never originates messages of its own.
 *
 * A tracker orders candidates by when it last heard from them, and a stumble counts the same as a walk response. Candidates heard from before the
 * requester come first, then the ones heard from after it, so a requester always gets an introduction once anybody else is around.
 */
public class TrackerCommunity extends Community
{
	public TrackerCommunity (String cid)
	{
		super (cid);
	}

	@Override
	protected List<Candidate> orderIntroductions (Candidate requester, List<Candidate> pool)
	{
		Candidate.Activity mine = requester.getActivity (this);
		long seen = mine == null ? Long.MAX_VALUE : mine.getLastSeenSequence ();

		List<Candidate> heard = new ArrayList<Candidate> ();
		for ( Candidate c : pool )
		{
			if ( c.getActivity (this).getLastSeenSequence () > 0 )
			{
				heard.add (c);
			}
		}
		Collections.sort (heard, new Comparator<Candidate> ()
		{
			@Override
			public int compare (Candidate a, Candidate b)
			{
				return Long.compare (b.getActivity (TrackerCommunity.this).getLastSeenSequence (), a.getActivity (TrackerCommunity.this)
						.getLastSeenSequence ());
			}
		});

		List<Candidate> result = new ArrayList<Candidate> ();
		List<Candidate> after = new ArrayList<Candidate> ();
		for ( Candidate c : heard )
		{
			if ( c.getActivity (this).getLastSeenSequence () < seen )
			{
				result.add (c);
			}
			else
			{
				after.add (c);
			}
		}
		result.addAll (after);
		return result;
	}
}
