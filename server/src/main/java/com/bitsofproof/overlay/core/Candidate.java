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

import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * A remote peer. The addresses and the NAT type describe the peer itself, everything that happened with it is kept separately per community, so
 * the same peer can be active in one community and unknown in another.
 *
 * Not thread safe; a candidate is driven by the thread that owns the communities it takes part in.
 */
public class Candidate
{
	public enum Category
	{
		WALK, STUMBLE, INTRO, NONE
	}

	/** a walk response keeps the candidate in the walk category this long (ms) */
	public static final long WALK_LIFETIME = 57500;
	public static final long STUMBLE_LIFETIME = 57500;
	public static final long INTRO_LIFETIME = 27500;
	/** minimum time between two walks to the same candidate (ms) */
	public static final long ELIGIBLE_DELAY = 27500;

	static class Activity
	{
		long lastStumble;
		long lastWalk;
		long lastWalkResponse;
		long lastIntro;
		long walkDeadline;

		long stumbleSequence;
		long walkSequence;
		long walkResponseSequence;

		long getLastActive ()
		{
			return Math.max (lastStumble, Math.max (lastWalk, lastWalkResponse));
		}

		long getLastSequence ()
		{
			return Math.max (stumbleSequence, Math.max (walkSequence, walkResponseSequence));
		}

		long getLastSeenSequence ()
		{
			return Math.max (stumbleSequence, walkResponseSequence);
		}

		void merge (Activity other)
		{
			lastStumble = Math.max (lastStumble, other.lastStumble);
			lastWalk = Math.max (lastWalk, other.lastWalk);
			lastWalkResponse = Math.max (lastWalkResponse, other.lastWalkResponse);
			lastIntro = Math.max (lastIntro, other.lastIntro);
			walkDeadline = Math.max (walkDeadline, other.walkDeadline);
			stumbleSequence = Math.max (stumbleSequence, other.stumbleSequence);
			walkSequence = Math.max (walkSequence, other.walkSequence);
			walkResponseSequence = Math.max (walkResponseSequence, other.walkResponseSequence);
		}
	}

	private final Address address;
	private final boolean bootstrap;
	private Address lanAddress;
	private Address wanAddress;
	private ConnectionType connectionType;

	private final Map<Community, Activity> activities = new HashMap<Community, Activity> ();

	public Candidate (Address address, boolean bootstrap, Address lanAddress, Address wanAddress, ConnectionType connectionType)
	{
		this.address = Preconditions.checkNotNull (address, "address");
		this.lanAddress = Preconditions.checkNotNull (lanAddress, "lanAddress");
		this.wanAddress = Preconditions.checkNotNull (wanAddress, "wanAddress");
		this.connectionType = Preconditions.checkNotNull (connectionType, "connectionType");
		this.bootstrap = bootstrap;
	}

	public Address getAddress ()
	{
		return address;
	}

	public Address getLanAddress ()
	{
		return lanAddress;
	}

	public Address getWanAddress ()
	{
		return wanAddress;
	}

	public ConnectionType getConnectionType ()
	{
		return connectionType;
	}

	public boolean isBootstrap ()
	{
		return bootstrap;
	}

	/**
	 * A newer message of the peer reported different addresses or NAT type.
	 */
	public void update (Address lanAddress, Address wanAddress, ConnectionType connectionType)
	{
		this.lanAddress = Preconditions.checkNotNull (lanAddress, "lanAddress");
		this.wanAddress = Preconditions.checkNotNull (wanAddress, "wanAddress");
		this.connectionType = Preconditions.checkNotNull (connectionType, "connectionType");
	}

	/**
	 * The peer contacted us unsolicited in this community.
	 */
	public void stumble (Community community, long now)
	{
		Activity a = activity (community);
		a.lastStumble = now;
		a.stumbleSequence = community.nextSequence ();
		community.getRegistry ().add (this);
	}

	/**
	 * We sent the peer a request and expect an answer within timeout milliseconds.
	 */
	public void walk (Community community, long now, long timeout)
	{
		Activity a = activity (community);
		a.lastWalk = now;
		a.walkDeadline = now + timeout;
		a.walkSequence = community.nextSequence ();
		community.getRegistry ().add (this);
	}

	public void walkResponse (Community community)
	{
		walkResponse (community, System.currentTimeMillis ());
	}

	/**
	 * The peer answered our request.
	 */
	public void walkResponse (Community community, long now)
	{
		Activity a = activity (community);
		a.lastWalkResponse = now;
		a.walkResponseSequence = community.nextSequence ();
		community.getRegistry ().add (this);
	}

	/**
	 * Another peer introduced this one to us. Does not count as activity of the peer itself.
	 */
	public void intro (Community community, long now)
	{
		activity (community).lastIntro = now;
		community.getRegistry ().add (this);
	}

	public boolean inCommunity (Community community)
	{
		return activities.containsKey (community);
	}

	public long getLastStumble (Community community)
	{
		Activity a = activities.get (community);
		return a == null ? 0 : a.lastStumble;
	}

	public long getLastWalk (Community community)
	{
		Activity a = activities.get (community);
		return a == null ? 0 : a.lastWalk;
	}

	public long getLastWalkResponse (Community community)
	{
		Activity a = activities.get (community);
		return a == null ? 0 : a.lastWalkResponse;
	}

	public long getLastIntro (Community community)
	{
		Activity a = activities.get (community);
		return a == null ? 0 : a.lastIntro;
	}

	public long getWalkDeadline (Community community)
	{
		Activity a = activities.get (community);
		return a == null ? 0 : a.walkDeadline;
	}

	/**
	 * A request is out and neither answered nor timed out.
	 */
	public boolean isWalkPending (Community community, long now)
	{
		Activity a = activities.get (community);
		return a != null && a.lastWalk > 0 && a.lastWalkResponse < a.lastWalk && now < a.walkDeadline;
	}

	public Category getCategory (Community community, long now)
	{
		Activity a = activities.get (community);
		if ( a == null )
		{
			return Category.NONE;
		}
		if ( a.lastWalkResponse > 0 && now < a.lastWalkResponse + WALK_LIFETIME )
		{
			return Category.WALK;
		}
		if ( a.lastStumble > 0 && now < a.lastStumble + STUMBLE_LIFETIME )
		{
			return Category.STUMBLE;
		}
		if ( a.lastIntro > 0 && now < a.lastIntro + INTRO_LIFETIME )
		{
			return Category.INTRO;
		}
		return Category.NONE;
	}

	/**
	 * Bootstrap candidates never time out, others need a live category.
	 */
	public boolean isEligibleForWalk (Community community, long now)
	{
		if ( isWalkPending (community, now) || now < getLastWalk (community) + ELIGIBLE_DELAY )
		{
			return false;
		}
		return bootstrap || getCategory (community, now) != Category.NONE;
	}

	/**
	 * Takes over the history of a duplicate: every timestamp becomes the most recent of the two, per community.
	 */
	void merge (Candidate other)
	{
		for ( Map.Entry<Community, Activity> e : other.activities.entrySet () )
		{
			activity (e.getKey ()).merge (e.getValue ());
		}
	}

	Activity getActivity (Community community)
	{
		return activities.get (community);
	}

	private Activity activity (Community community)
	{
		Activity a = activities.get (community);
		if ( a == null )
		{
			a = new Activity ();
			activities.put (community, a);
		}
		return a;
	}

	@Override
	public String toString ()
	{
		return "{" + lanAddress + " " + wanAddress + "}";
	}
}
