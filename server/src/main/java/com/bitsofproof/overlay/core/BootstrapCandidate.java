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
 * Seed peer obtained by resolving a well known host name. Never introduced to anyone and never timed out. Two bootstrap candidates are equal when they
 * point to the same address.
 */
public class BootstrapCandidate extends Candidate
{
	public BootstrapCandidate (Address address)
	{
		super (address, true, address, address, ConnectionType.UNKNOWN);
	}

	@Override
	public boolean equals (Object obj)
	{
		if ( obj == this )
		{
			return true;
		}
		return obj instanceof BootstrapCandidate && getAddress ().equals (((BootstrapCandidate) obj).getAddress ());
	}

	@Override
	public int hashCode ()
	{
		return getAddress ().hashCode ();
	}
}
