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

/**
 * NAT classification a peer reports about itself.
 */
public enum ConnectionType
{
	UNKNOWN ("unknown"),
	/** outbound source port changes per destination, so ports do not identify the peer */
	SYMMETRIC_NAT ("symmetric-NAT");

	private final String wireName;

	private ConnectionType (String wireName)
	{
		this.wireName = wireName;
	}

	public String getWireName ()
	{
		return wireName;
	}

	/**
	 * Anything not recognized is treated as unknown.
	 */
	public static ConnectionType fromWireName (String name)
	{
		for ( ConnectionType t : values () )
		{
			if ( t.wireName.equals (name) )
			{
				return t;
			}
		}
		return UNKNOWN;
	}
}
