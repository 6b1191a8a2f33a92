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

import com.google.common.base.Preconditions;

/**
 * Host and port of a peer. The host is an IP literal or a host name and is never resolved by this class.
 */
public final class Address
{
	private final String host;
	private final int port;

	public Address (String host, int port)
	{
		Preconditions.checkNotNull (host, "host");
		Preconditions.checkArgument (port >= 0 && port <= 0xffff, "port out of range: %s", port);
		this.host = host;
		this.port = port;
	}

	public String getHost ()
	{
		return host;
	}

	public int getPort ()
	{
		return port;
	}

	@Override
	public boolean equals (Object obj)
	{
		if ( obj == this )
		{
			return true;
		}
		if ( !(obj instanceof Address) )
		{
			return false;
		}
		Address other = (Address) obj;
		return port == other.port && host.equals (other.host);
	}

	@Override
	public int hashCode ()
	{
		return host.hashCode () * 31 + port;
	}

	@Override
	public String toString ()
	{
		return host + ":" + port;
	}
}
