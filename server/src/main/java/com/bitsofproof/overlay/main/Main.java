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
import java.security.Security;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.PropertyConfigurator;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.GenericXmlApplicationContext;

/**
 * Launches the {@link App} wired in the Spring context. Arguments before "--" name the profiles to activate, the rest goes to the app.
 */
public class Main
{
	protected interface App
	{
		public void start (String[] args) throws Exception;
	}

	static final String LOG_CONFIG = "config/log4j.properties";
	static final String SERVER_CONTEXT = "classpath:context/server.xml";
	static final String PROFILE_CONTEXTS = "classpath*:context/*-profile.xml";
	static final String SEPARATOR = "--";

	static
	{
		configureLogging (new File (LOG_CONFIG));
	}

	private static final Logger log = LoggerFactory.getLogger (Main.class);

	/**
	 * A log configuration in the working directory overrides the log4j.properties on the classpath.
	 */
	static boolean configureLogging (File config)
	{
		if ( !config.isFile () )
		{
			return false;
		}
		PropertyConfigurator.configure (config.getPath ());
		return true;
	}

	/**
	 * Command line split at the first "--". Later separators belong to the app.
	 */
	static class LaunchArguments
	{
		private final List<String> profiles = new ArrayList<String> ();
		private final List<String> appArguments = new ArrayList<String> ();

		LaunchArguments (String[] args)
		{
			List<String> target = profiles;
			for ( String s : args )
			{
				if ( target == profiles && s.equals (SEPARATOR) )
				{
					target = appArguments;
				}
				else
				{
					target.add (s);
				}
			}
		}

		String[] getProfiles ()
		{
			return profiles.toArray (new String[profiles.size ()]);
		}

		String[] getAppArguments ()
		{
			return appArguments.toArray (new String[appArguments.size ()]);
		}
	}

	static GenericXmlApplicationContext createContext (String... profiles)
	{
		GenericXmlApplicationContext ctx = new GenericXmlApplicationContext ();
		for ( String profile : profiles )
		{
			log.info ("Activating profile " + profile);
		}
		ctx.getEnvironment ().setActiveProfiles (profiles);
		ctx.load (SERVER_CONTEXT, PROFILE_CONTEXTS);
		ctx.refresh ();
		return ctx;
	}

	public static void main (String[] args)
	{
		log.info ("bitsofproof overlay node (c) 2013-2014 bits of proof zrt.");
		Security.addProvider (new BouncyCastleProvider ());

		LaunchArguments launch = new LaunchArguments (args);
		GenericXmlApplicationContext ctx = null;
		try
		{
			ctx = createContext (launch.getProfiles ());
			ctx.registerShutdownHook ();
			ctx.getBean (App.class).start (launch.getAppArguments ());
		}
		catch ( Exception e )
		{
			log.error ("Node failed", e);
		}
		finally
		{
			if ( ctx != null )
			{
				ctx.close ();
			}
		}
	}
}
