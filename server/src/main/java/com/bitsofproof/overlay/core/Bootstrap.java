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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Resolves the well known bootstrap host names into {@link BootstrapCandidate}s.
 *
 * The configured addresses never change; only whether they are resolved does. Several names may point to the same IP, those collapse into a single
 * candidate, so an attacker has to disrupt the DNS of every domain to take the bootstrap peers away.
 *
 * All methods are thread safe. Lookups run on worker threads; the periodic resolution runs on its own single thread with a fixed delay, so two
 * rounds never overlap.
 */
public class Bootstrap
{
	private static final Logger log = LoggerFactory.getLogger (Bootstrap.class);

	private static final List<Address> DEFAULT_ADDRESSES;
	static
	{
		ImmutableList.Builder<Address> b = ImmutableList.builder ();
		for ( int i = 1; i <= 8; ++i )
		{
			b.add (new Address ("dispersy" + i + ".tribler.org", 6420 + i));
		}
		for ( int i = 1; i <= 8; ++i )
		{
			b.add (new Address ("dispersy" + i + ".st.tudelft.nl", 6420 + i));
		}
		DEFAULT_ADDRESSES = b.build ();
	}

	private static volatile boolean enabled = true;

	public static class Progress
	{
		private final int resolved;
		private final int total;

		public Progress (int resolved, int total)
		{
			this.resolved = resolved;
			this.total = total;
		}

		public int getResolved ()
		{
			return resolved;
		}

		public int getTotal ()
		{
			return total;
		}

		@Override
		public boolean equals (Object obj)
		{
			return obj instanceof Progress && ((Progress) obj).resolved == resolved && ((Progress) obj).total == total;
		}

		@Override
		public int hashCode ()
		{
			return resolved * 31 + total;
		}

		@Override
		public String toString ()
		{
			return resolved + "/" + total;
		}
	}

	private final Object lock = new Object ();
	// null value: not resolved (yet)
	private final Map<Address, BootstrapCandidate> candidates = new LinkedHashMap<Address, BootstrapCandidate> ();
	private ScheduledFuture<?> resolution;
	private HostResolver resolver = HostResolver.DNS;

	private final ExecutorService lookups = Executors.newCachedThreadPool (new DaemonThreadFactory ("bootstrap-lookup"));
	private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor (new DaemonThreadFactory ("bootstrap-resolution"));

	public Bootstrap (List<Address> addresses)
	{
		Preconditions.checkNotNull (addresses, "addresses");
		for ( Address a : addresses )
		{
			candidates.put (Preconditions.checkNotNull (a, "address"), null);
		}
	}

	public static List<Address> getDefaultAddresses ()
	{
		return DEFAULT_ADDRESSES;
	}

	/**
	 * Reads "host port" lines, skipping comments starting with # and lines that do not parse.
	 *
	 * @return the addresses, or an empty list if the file can not be read
	 */
	public static List<Address> loadAddressesFromFile (File file)
	{
		List<Address> addresses = new ArrayList<Address> ();
		BufferedReader reader = null;
		try
		{
			reader = new BufferedReader (new InputStreamReader (new FileInputStream (file), StandardCharsets.UTF_8));
			String line;
			while ( (line = reader.readLine ()) != null )
			{
				line = line.trim ();
				if ( line.isEmpty () || line.startsWith ("#") )
				{
					continue;
				}
				String[] split = line.split ("\\s+");
				if ( split.length != 2 )
				{
					log.debug ("Skipping bootstrap line " + line);
					continue;
				}
				try
				{
					addresses.add (new Address (split[0], Integer.parseInt (split[1])));
				}
				catch ( IllegalArgumentException e )
				{
					log.debug ("Skipping bootstrap line " + line);
				}
			}
		}
		catch ( IOException e )
		{
			log.warn ("Can not read bootstrap addresses from " + file + ": " + e.getMessage ());
			return new ArrayList<Address> ();
		}
		finally
		{
			if ( reader != null )
			{
				try
				{
					reader.close ();
				}
				catch ( IOException e )
				{
					log.trace ("Can not close " + file, e);
				}
			}
		}
		return addresses;
	}

	public static boolean isEnabled ()
	{
		return enabled;
	}

	/**
	 * Switches all bootstrap network activity on or off, e.g. for isolated test runs.
	 */
	public static void setEnabled (boolean enabled)
	{
		Bootstrap.enabled = enabled;
	}

	public void setHostResolver (HostResolver resolver)
	{
		this.resolver = Preconditions.checkNotNull (resolver, "resolver");
	}

	public boolean areResolved ()
	{
		synchronized ( lock )
		{
			return !candidates.containsValue (null);
		}
	}

	/**
	 * @return the resolved candidates; addresses resolving to the same IP and port appear once
	 */
	public Set<BootstrapCandidate> getCandidates ()
	{
		synchronized ( lock )
		{
			Set<BootstrapCandidate> resolved = new LinkedHashSet<BootstrapCandidate> ();
			for ( BootstrapCandidate c : candidates.values () )
			{
				if ( c != null )
				{
					resolved.add (c);
				}
			}
			return resolved;
		}
	}

	public Progress getProgress ()
	{
		synchronized ( lock )
		{
			int resolved = 0;
			for ( BootstrapCandidate c : candidates.values () )
			{
				if ( c != null )
				{
					++resolved;
				}
			}
			return new Progress (resolved, candidates.size ());
		}
	}

	/**
	 * Forgets every resolution. The configured addresses stay.
	 */
	public void reset ()
	{
		synchronized ( lock )
		{
			for ( Map.Entry<Address, BootstrapCandidate> e : candidates.entrySet () )
			{
				e.setValue (null);
			}
		}
	}

	/**
	 * Looks up every unresolved address, all at the same time, and waits until each lookup succeeded or failed. A failed lookup leaves its address
	 * unresolved for a later round.
	 *
	 * @return true if at least one address is resolved now, false if disabled or nothing could be resolved
	 */
	public boolean resolve ()
	{
		if ( !enabled )
		{
			return false;
		}
		List<Address> unresolved = new ArrayList<Address> ();
		synchronized ( lock )
		{
			for ( Map.Entry<Address, BootstrapCandidate> e : candidates.entrySet () )
			{
				if ( e.getValue () == null )
				{
					unresolved.add (e.getKey ());
				}
			}
		}

		List<Future<Boolean>> pending = new ArrayList<Future<Boolean>> ();
		for ( final Address address : unresolved )
		{
			pending.add (lookups.submit (new Callable<Boolean> ()
			{
				@Override
				public Boolean call ()
				{
					return lookup (address);
				}
			}));
		}
		for ( int i = 0; i < pending.size (); ++i )
		{
			try
			{
				pending.get (i).get ();
			}
			catch ( ExecutionException e )
			{
				log.info ("Could not resolve bootstrap candidate " + unresolved.get (i), e.getCause ());
			}
			catch ( InterruptedException e )
			{
				// lookups still running will record their result when they finish
				Thread.currentThread ().interrupt ();
				break;
			}
		}
		return getProgress ().getResolved () > 0;
	}

	private boolean lookup (Address address)
	{
		InetAddress ip;
		try
		{
			ip = resolver.resolve (address.getHost ());
		}
		catch ( UnknownHostException e )
		{
			log.info ("Could not resolve bootstrap candidate: " + address);
			return false;
		}
		if ( ip == null )
		{
			log.info ("Could not resolve bootstrap candidate: " + address);
			return false;
		}
		BootstrapCandidate candidate = new BootstrapCandidate (new Address (ip.getHostAddress (), address.getPort ()));
		synchronized ( lock )
		{
			candidates.put (address, candidate);
		}
		log.debug ("Resolved " + address.getHost () + " into " + candidate.getAddress ());
		return true;
	}

	/**
	 * Calls {@link #resolve()} every interval until all addresses are resolved. Does nothing if already running or disabled.
	 *
	 * @param now
	 *            run the first round right away instead of after one interval
	 */
	public void resolveUntilSuccess (long interval, TimeUnit unit, boolean now)
	{
		synchronized ( lock )
		{
			if ( resolution != null || !enabled )
			{
				return;
			}
			resolution = scheduler.scheduleWithFixedDelay (new Runnable ()
			{
				@Override
				public void run ()
				{
					if ( !areResolved () )
					{
						log.warn ("Resolving bootstrap addresses");
						resolve ();
					}
					if ( areResolved () )
					{
						log.debug ("All bootstrap addresses resolved " + getProgress ());
						stop ();
					}
				}
			}, now ? 0 : interval, interval, unit);
		}
	}

	public boolean isResolving ()
	{
		synchronized ( lock )
		{
			return resolution != null;
		}
	}

	/**
	 * Stops periodic resolution. Resolved candidates are kept, lookups in flight may still complete.
	 */
	public void stop ()
	{
		synchronized ( lock )
		{
			if ( resolution != null )
			{
				resolution.cancel (false);
				resolution = null;
			}
		}
	}

	/**
	 * Stops and releases the worker threads.
	 */
	public void shutdown ()
	{
		stop ();
		scheduler.shutdownNow ();
		lookups.shutdown ();
	}
}
