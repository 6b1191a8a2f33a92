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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.net.InetAddress;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class BootstrapTest
{
	private static class FakeResolver implements HostResolver
	{
		private final Map<String, byte[]> hosts = new HashMap<String, byte[]> ();
		private final Set<String> failing = new HashSet<String> ();
		private final AtomicInteger lookups = new AtomicInteger ();

		FakeResolver add (String host, int a, int b, int c, int d)
		{
			hosts.put (host, new byte[] { (byte) a, (byte) b, (byte) c, (byte) d });
			return this;
		}

		@Override
		public InetAddress resolve (String host) throws UnknownHostException
		{
			lookups.incrementAndGet ();
			synchronized ( failing )
			{
				if ( failing.contains (host) || !hosts.containsKey (host) )
				{
					throw new UnknownHostException (host);
				}
			}
			return InetAddress.getByAddress (host, hosts.get (host));
		}

		void fail (String host)
		{
			synchronized ( failing )
			{
				failing.add (host);
			}
		}

		void recover (String host)
		{
			synchronized ( failing )
			{
				failing.remove (host);
			}
		}
	}

	private final List<Bootstrap> created = new ArrayList<Bootstrap> ();

	private Bootstrap bootstrap (FakeResolver resolver, String... hosts)
	{
		List<Address> addresses = new ArrayList<Address> ();
		int port = 6421;
		for ( String host : hosts )
		{
			addresses.add (new Address (host, port++));
		}
		Bootstrap bootstrap = new Bootstrap (addresses);
		bootstrap.setHostResolver (resolver);
		created.add (bootstrap);
		return bootstrap;
	}

	@Before
	public void enable ()
	{
		Bootstrap.setEnabled (true);
	}

	@After
	public void cleanup ()
	{
		Bootstrap.setEnabled (true);
		for ( Bootstrap b : created )
		{
			b.shutdown ();
		}
	}

	@Test
	public void resolveAll ()
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1).add ("b.example.org", 10, 0, 0, 2).add ("c.example.org", 10, 0, 0, 3);
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org", "b.example.org", "c.example.org");
		assertFalse (bootstrap.areResolved ());
		assertEquals (new Bootstrap.Progress (0, 3), bootstrap.getProgress ());

		assertTrue (bootstrap.resolve ());
		assertTrue (bootstrap.areResolved ());
		assertEquals (new Bootstrap.Progress (3, 3), bootstrap.getProgress ());
		assertEquals (3, bootstrap.getCandidates ().size ());
		assertTrue (bootstrap.getCandidates ().contains (new BootstrapCandidate (new Address ("10.0.0.2", 6422))));
		for ( BootstrapCandidate c : bootstrap.getCandidates () )
		{
			assertTrue (c.isBootstrap ());
		}

		// nothing left to look up
		assertTrue (bootstrap.resolve ());
		assertEquals (3, resolver.lookups.get ());
	}

	@Test
	public void reset ()
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1).add ("b.example.org", 10, 0, 0, 2);
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org", "b.example.org");
		assertTrue (bootstrap.resolve ());
		bootstrap.reset ();
		assertFalse (bootstrap.areResolved ());
		assertTrue (bootstrap.getCandidates ().isEmpty ());
		assertEquals (new Bootstrap.Progress (0, 2), bootstrap.getProgress ());

		assertTrue (bootstrap.resolve ());
		assertTrue (bootstrap.areResolved ());
		assertEquals (4, resolver.lookups.get ());
	}

	@Test
	public void partialFailure ()
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1).add ("b.example.org", 10, 0, 0, 2);
		resolver.fail ("b.example.org");
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org", "b.example.org");
		assertTrue (bootstrap.resolve ());
		assertFalse (bootstrap.areResolved ());
		assertEquals (new Bootstrap.Progress (1, 2), bootstrap.getProgress ());

		resolver.recover ("b.example.org");
		assertTrue (bootstrap.resolve ());
		assertTrue (bootstrap.areResolved ());
		// the resolved one was not asked again
		assertEquals (3, resolver.lookups.get ());
	}

	@Test
	public void nothingResolves ()
	{
		FakeResolver resolver = new FakeResolver ();
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org");
		assertFalse (bootstrap.resolve ());
		assertFalse (bootstrap.areResolved ());
	}

	@Test
	public void sameIpCollapses ()
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1).add ("b.example.org", 10, 0, 0, 1);
		Bootstrap bootstrap = new Bootstrap (Arrays.asList (new Address ("a.example.org", 6421), new Address ("b.example.org", 6421)));
		bootstrap.setHostResolver (resolver);
		created.add (bootstrap);

		assertTrue (bootstrap.resolve ());
		assertEquals (new Bootstrap.Progress (2, 2), bootstrap.getProgress ());
		assertEquals (1, bootstrap.getCandidates ().size ());
	}

	@Test
	public void disabled ()
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1);
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org");
		Bootstrap.setEnabled (false);
		assertFalse (Bootstrap.isEnabled ());
		assertFalse (bootstrap.resolve ());
		bootstrap.resolveUntilSuccess (10, TimeUnit.MILLISECONDS, true);
		assertFalse (bootstrap.isResolving ());
		assertEquals (0, resolver.lookups.get ());
	}

	@Test
	public void resolveUntilSuccess () throws InterruptedException
	{
		FakeResolver resolver = new FakeResolver ().add ("a.example.org", 10, 0, 0, 1).add ("b.example.org", 10, 0, 0, 2);
		resolver.fail ("b.example.org");
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org", "b.example.org");

		bootstrap.resolveUntilSuccess (20, TimeUnit.MILLISECONDS, true);
		bootstrap.resolveUntilSuccess (20, TimeUnit.MILLISECONDS, true);
		assertTrue (bootstrap.isResolving ());
		waitFor (bootstrap, 1);
		assertTrue (bootstrap.isResolving ());

		resolver.recover ("b.example.org");
		waitFor (bootstrap, 2);
		long deadline = System.currentTimeMillis () + 5000;
		while ( bootstrap.isResolving () && System.currentTimeMillis () < deadline )
		{
			Thread.sleep (10);
		}
		assertFalse (bootstrap.isResolving ());
		assertTrue (bootstrap.areResolved ());
	}

	@Test
	public void stop ()
	{
		FakeResolver resolver = new FakeResolver ();
		Bootstrap bootstrap = bootstrap (resolver, "a.example.org");
		bootstrap.resolveUntilSuccess (1, TimeUnit.HOURS, false);
		assertTrue (bootstrap.isResolving ());
		bootstrap.stop ();
		assertFalse (bootstrap.isResolving ());
		bootstrap.stop ();
		assertFalse (bootstrap.isResolving ());
		assertEquals (0, resolver.lookups.get ());
	}

	private static void waitFor (Bootstrap bootstrap, int resolved) throws InterruptedException
	{
		long deadline = System.currentTimeMillis () + 5000;
		while ( bootstrap.getProgress ().getResolved () < resolved && System.currentTimeMillis () < deadline )
		{
			Thread.sleep (10);
		}
		assertEquals (resolved, bootstrap.getProgress ().getResolved ());
	}

	@Test
	public void defaultAddresses ()
	{
		List<Address> defaults = Bootstrap.getDefaultAddresses ();
		assertEquals (16, defaults.size ());
		assertEquals (new Address ("dispersy1.tribler.org", 6421), defaults.get (0));
		assertEquals (new Address ("dispersy8.tribler.org", 6428), defaults.get (7));
		assertEquals (new Address ("dispersy1.st.tudelft.nl", 6421), defaults.get (8));
		assertEquals (new Address ("dispersy8.st.tudelft.nl", 6428), defaults.get (15));
	}

	@Test
	public void seedFile () throws URISyntaxException
	{
		File seeds = new File (getClass ().getResource ("/seeds.txt").toURI ());
		assertEquals (Arrays.asList (new Address ("seed1.example.org", 6421), new Address ("seed2.example.org", 6422), new Address ("10.0.0.1", 6426)),
				Bootstrap.loadAddressesFromFile (seeds));
		assertTrue (Bootstrap.loadAddressesFromFile (new File ("does/not/exist.txt")).isEmpty ());
	}
}
