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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named daemon threads, so background work never keeps the VM alive.
 */
class DaemonThreadFactory implements ThreadFactory
{
	private final String name;
	private final AtomicInteger count = new AtomicInteger ();

	DaemonThreadFactory (String name)
	{
		this.name = name;
	}

	@Override
	public Thread newThread (final Runnable r)
	{
		Thread thread = new Thread (r);
		thread.setDaemon (true);
		thread.setName (name + "-" + count.incrementAndGet ());
		return thread;
	}
}
