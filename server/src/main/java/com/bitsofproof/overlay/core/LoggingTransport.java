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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bitsofproof.overlay.common.ByteUtils;

/**
 * Transport for nodes without a network: every outgoing message is only logged.
 */
public class LoggingTransport implements WalkTransport
{
	private static final Logger log = LoggerFactory.getLogger (LoggingTransport.class);

	@Override
	public void sendIntroductionRequest (Address destination, IntroductionRequest request, byte[] signature)
	{
		log.debug ("Not sending " + request + " to " + destination + " signed " + ByteUtils.toHex (signature));
	}

	@Override
	public void sendIntroductionResponse (Address destination, IntroductionResponse response, byte[] signature)
	{
		log.debug ("Not sending " + response + " to " + destination + " signed " + ByteUtils.toHex (signature));
	}
}
