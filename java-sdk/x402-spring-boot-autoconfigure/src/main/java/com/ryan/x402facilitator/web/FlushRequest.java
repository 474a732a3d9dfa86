package com.ryan.x402facilitator.web;

import com.ryan.x402facilitator.model.deferred.FlushAuthorization;

/**
 * Body of POST /deferred/buyers/{buyer}/flush.
 */
public class FlushRequest {

  public FlushAuthorization flushAuthorization;
  public String escrow;
  public long chainId;
}
