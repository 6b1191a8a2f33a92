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

import org.bouncycastle.util.Arrays;

import com.bitsofproof.overlay.common.ValidationException;
import com.google.common.base.Preconditions;

/**
 * Common part of the walk messages: who sends, to whom and in which community. The signature covers the SHA-256 of {@link #toByteArray()}.
 */
public abstract class WalkMessage
{
	static final int INTRODUCTION_REQUEST = 246;
	static final int INTRODUCTION_RESPONSE = 245;

	private final String cid;
	private final byte[] memberKey;
	private final Address destination;
	private final Address sourceLan;
	private final Address sourceWan;
	private final ConnectionType connectionType;
	private final int identifier;

	protected WalkMessage (String cid, byte[] memberKey, Address destination, Address sourceLan, Address sourceWan, ConnectionType connectionType,
			int identifier)
	{
		this.cid = Preconditions.checkNotNull (cid, "cid");
		this.memberKey = Arrays.clone (Preconditions.checkNotNull (memberKey, "memberKey"));
		this.destination = Preconditions.checkNotNull (destination, "destination");
		this.sourceLan = Preconditions.checkNotNull (sourceLan, "sourceLan");
		this.sourceWan = Preconditions.checkNotNull (sourceWan, "sourceWan");
		this.connectionType = Preconditions.checkNotNull (connectionType, "connectionType");
		Preconditions.checkArgument (identifier >= 0 && identifier <= 0xffff, "identifier out of range");
		this.identifier = identifier;
	}

	protected abstract int getType ();

	protected abstract void toWire (WireFormat.Writer writer);

	public byte[] toByteArray ()
	{
		WireFormat.Writer writer = new WireFormat.Writer ();
		writer.writeByte (getType ());
		writer.writeString (cid);
		writer.writeVarBytes (memberKey);
		writer.writeAddress (destination);
		writer.writeAddress (sourceLan);
		writer.writeAddress (sourceWan);
		writer.writeString (connectionType.getWireName ());
		writer.writeUint16 (identifier);
		toWire (writer);
		return writer.toByteArray ();
	}

	/**
	 * Decodes a message received from the network.
	 */
	public static WalkMessage fromByteArray (byte[] bytes) throws ValidationException
	{
		if ( bytes == null || bytes.length == 0 )
		{
			throw new ValidationException ("Empty message");
		}
		try
		{
			WireFormat.Reader reader = new WireFormat.Reader (bytes);
			int type = reader.readByte ();
			String cid = reader.readString ();
			byte[] memberKey = reader.readVarBytes ();
			Address destination = reader.readAddress ();
			Address sourceLan = reader.readAddress ();
			Address sourceWan = reader.readAddress ();
			ConnectionType connectionType = ConnectionType.fromWireName (reader.readString ());
			int identifier = reader.readUint16 ();
			WalkMessage message;
			if ( type == INTRODUCTION_REQUEST )
			{
				message = new IntroductionRequest (cid, memberKey, destination, sourceLan, sourceWan, connectionType, identifier, reader.readByte () != 0);
			}
			else if ( type == INTRODUCTION_RESPONSE )
			{
				Address lanIntroduced = reader.readAddress ();
				Address wanIntroduced = reader.readAddress ();
				message =
						new IntroductionResponse (cid, memberKey, destination, sourceLan, sourceWan, connectionType, identifier, lanIntroduced,
								wanIntroduced);
			}
			else
			{
				throw new ValidationException ("Unknown message type " + type);
			}
			if ( !reader.eof () )
			{
				throw new ValidationException ("Trailing bytes after " + message);
			}
			return message;
		}
		catch ( RuntimeException e )
		{
			// truncated input or a field out of range
			throw new ValidationException ("Malformed message", e);
		}
	}

	public String getCid ()
	{
		return cid;
	}

	public byte[] getMemberKey ()
	{
		return Arrays.clone (memberKey);
	}

	public Address getDestination ()
	{
		return destination;
	}

	public Address getSourceLan ()
	{
		return sourceLan;
	}

	public Address getSourceWan ()
	{
		return sourceWan;
	}

	public ConnectionType getConnectionType ()
	{
		return connectionType;
	}

	public int getIdentifier ()
	{
		return identifier;
	}
}
