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
 * Sent to the walk target. The target answers with an {@link IntroductionResponse} naming another peer of the community.
 */
public class IntroductionRequest extends WalkMessage
{
	private final boolean advice;

	public IntroductionRequest (String cid, byte[] memberKey, Address destination, Address sourceLan, Address sourceWan,
			ConnectionType connectionType, int identifier, boolean advice)
	{
		super (cid, memberKey, destination, sourceLan, sourceWan, connectionType, identifier);
		this.advice = advice;
	}

	/**
	 * @return true if the sender wants to be introduced to someone
	 */
	public boolean isAdvice ()
	{
		return advice;
	}

	@Override
	protected int getType ()
	{
		return INTRODUCTION_REQUEST;
	}

	@Override
	protected void toWire (WireFormat.Writer writer)
	{
		writer.writeByte (advice ? 1 : 0);
	}

	@Override
	public String toString ()
	{
		return "IntroductionRequest[" + getIdentifier () + " to " + getDestination () + "]";
	}
}
