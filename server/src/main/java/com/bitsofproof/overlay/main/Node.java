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
package com.bitsofproof.overlay.main;

import java.io.File;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bitsofproof.overlay.common.ValidationException;
import com.bitsofproof.overlay.core.Address;
import com.bitsofproof.overlay.core.Bootstrap;
import com.bitsofproof.overlay.core.Walker;

/**
 * Overlay node: resolves the bootstrap peers and walks the configured communities until the process is terminated.
 */
public class Node extends Main implements Main.App
{
	private static final Logger log = LoggerFactory.getLogger (Node.class);

	/** seconds between two bootstrap resolution rounds */
	public static final long BOOTSTRAP_RETRY = 300;

	private Walker walker;
	private Bootstrap bootstrap;
	private final CountDownLatch stopped = new CountDownLatch (1);

	Options getOptions ()
	{
		Options options = new Options ();
		options.addOption ("h", "help", false, "Print this help");
		options.addOption ("s", "seeds", true, "Bootstrap addresses, one \"host port\" per line");
		options.addOption ("i", "interval", true, "Milliseconds between two walk steps");
		return options;
	}

	/**
	 * Applies the command line to the configured beans.
	 *
	 * @return false if the node should not start
	 */
	boolean configure (String[] args)
	{
		final CommandLineParser parser = new GnuParser ();
		final Options options = getOptions ();
		CommandLine cl;
		try
		{
			cl = parser.parse (options, args);
		}
		catch ( ParseException e )
		{
			log.error ("Invalid options ", e);
			return false;
		}
		if ( cl.hasOption ('h') )
		{
			new HelpFormatter ().printHelp ("java -jar overlay.jar profile [profile...] -- [options...]", options);
			return false;
		}
		if ( cl.hasOption ('i') )
		{
			try
			{
				walker.setInterval (Long.parseLong (cl.getOptionValue ('i')));
			}
			catch ( IllegalArgumentException e )
			{
				log.error ("Invalid interval " + cl.getOptionValue ('i'));
				return false;
			}
		}
		if ( cl.hasOption ('s') )
		{
			List<Address> seeds = Bootstrap.loadAddressesFromFile (new File (cl.getOptionValue ('s')));
			log.info ("Loaded " + seeds.size () + " bootstrap addresses from " + cl.getOptionValue ('s'));
			if ( bootstrap != null )
			{
				bootstrap.shutdown ();
			}
			bootstrap = new Bootstrap (seeds);
			walker.setBootstrap (bootstrap);
		}
		return true;
	}

	@Override
	public void start (String[] args) throws ValidationException, InterruptedException
	{
		if ( !configure (args) )
		{
			return;
		}
		Runtime.getRuntime ().addShutdownHook (new Thread ()
		{
			@Override
			public void run ()
			{
				shutdown ();
			}
		});
		if ( bootstrap != null )
		{
			bootstrap.resolveUntilSuccess (BOOTSTRAP_RETRY, TimeUnit.SECONDS, true);
		}
		walker.start ();
		stopped.await ();
	}

	public void shutdown ()
	{
		walker.stop ();
		if ( bootstrap != null )
		{
			bootstrap.shutdown ();
		}
		stopped.countDown ();
	}

	public void setWalker (Walker walker)
	{
		this.walker = walker;
	}

	public void setBootstrap (Bootstrap bootstrap)
	{
		this.bootstrap = bootstrap;
	}

	Bootstrap getBootstrap ()
	{
		return bootstrap;
	}
}
