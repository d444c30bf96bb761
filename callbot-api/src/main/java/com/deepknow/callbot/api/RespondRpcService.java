package com.deepknow.callbot.api;

import com.deepknow.callbot.api.request.RespondRequest;
import com.deepknow.callbot.api.response.RespondResponse;

/**
 * 阻塞式问答 RPC：与 POST /api/respond 语义一致。
 */
public interface RespondRpcService {
    RespondResponse respond(RespondRequest req);
}
