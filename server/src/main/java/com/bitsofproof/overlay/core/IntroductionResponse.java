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

public class IntroductionResponse extends WalkMessage
{
	private final Address lanIntroduced;
	private final Address wanIntroduced;

	/**
	 * @param lanIntroduced
	 *            null if there is nobody to introduce
	 * @param wanIntroduced
	 *            null if there is nobody to introduce
	 */
	public IntroductionResponse (String cid, byte[] memberKey, Address destination, Address sourceLan, Address sourceWan,
			ConnectionType connectionType, int identifier, Address lanIntroduced, Address wanIntroduced)
	{
		super (cid, memberKey, destination, sourceLan, sourceWan, connectionType, identifier);
		this.lanIntroduced = lanIntroduced;
		this.wanIntroduced = wanIntroduced;
	}

	public Address getLanIntroduced ()
	{
		return lanIntroduced;
	}

	public Address getWanIntroduced ()
	{
		return wanIntroduced;
	}

	public boolean hasIntroduction ()
	{
		return lanIntroduced != null && wanIntroduced != null;
	}

	@Override
	protected int getType ()
	{
		return INTRODUCTION_RESPONSE;
	}

	@Override
	protected void toWire (WireFormat.Writer writer)
	{
		writer.writeAddress (lanIntroduced);
		writer.writeAddress (wanIntroduced);
	}

	@Override
	public String toString ()
	{
		return "IntroductionResponse[" + getIdentifier () + " to " + getDestination () + " introducing " + wanIntroduced + "]";
	}
}
