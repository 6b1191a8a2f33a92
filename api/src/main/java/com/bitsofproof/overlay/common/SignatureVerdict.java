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
package com.bitsofproof.overlay.common;

/**
 * Outcome of checking a fixed width signature.
 */
public enum SignatureVerdict
{
	VALID,
	/** signature is not 2 * component length bytes */
	MALFORMED_LENGTH,
	/** r or s is all zero bytes */
	MALFORMED_SCALAR,
	/** well formed, but the curve arithmetic said no */
	REJECTED;

	public boolean isValid ()
	{
		return this == VALID;
	}
}
