/*
 * Copyright 2000-2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.turn.vnet.client.serve;

import com.turn.vnet.Constants;
import com.turn.vnet.client.storage.SliceStorage;
import com.turn.vnet.common.LoggerUtils;
import com.turn.vnet.common.VnetLoggerFactory;
import com.turn.vnet.common.protocol.ExtendedInfo;
import com.turn.vnet.common.protocol.FileFeedMessage;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.RequestHandler;
import com.turn.vnet.network.RequestHandlers;
import com.turn.vnet.network.Responder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.text.ParseException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves FILE_FEED requests of other nodes from local slice storage.
 *
 * <p>
 * Reads run on the given executor. At most {@code maxConcurrentServes}
 * requests are served at once; requests over that budget are refused with
 * {@code NODE_BUSY}, whose hint is the number of serves in progress.
 * Requests for slices this node does not have are refused with
 * {@code NO_SLICE_AVAILABLE}, malformed ones rejected as
 * {@link ConnectionError#PROTOCOL}.
 * </p>
 */
public class SliceFeedRequestHandler implements RequestHandler {

  private static final Logger logger = VnetLoggerFactory.getLogger(SliceFeedRequestHandler.class);

  private final SliceStorageProvider myProvider;
  private final Executor myExecutor;
  private final int myMaxConcurrentServes;
  private final AtomicInteger myServing = new AtomicInteger();

  public SliceFeedRequestHandler(@NotNull SliceStorageProvider provider,
                                 @NotNull Executor executor,
                                 int maxConcurrentServes) {
    if (maxConcurrentServes < 0) {
      throw new IllegalArgumentException("Negative serve budget " + maxConcurrentServes);
    }
    myProvider = provider;
    myExecutor = executor;
    myMaxConcurrentServes = maxConcurrentServes;
  }

  public SliceFeedRequestHandler(@NotNull SliceStorageProvider provider, @NotNull Executor executor) {
    this(provider, executor, Constants.DEFAULT_MAX_CONCURRENT_SERVES);
  }

  public void register(@NotNull RequestHandlers handlers) {
    handlers.register(Constants.FILE_FEED_REQUEST, this);
  }

  @Override
  public void onRequest(int type, ByteBuffer payload, final Responder responder) {
    final FileFeedMessage.RequestMessage request;
    try {
      request = FileFeedMessage.RequestMessage.parse(payload);
    } catch (ParseException e) {
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "rejecting malformed request of type 0x{}",
              Integer.toHexString(type), e);
      responder.reject(ConnectionError.PROTOCOL);
      return;
    }

    final SliceStorage storage = myProvider.getStorage(request.getContentId(), request.getSliceId());
    if (storage == null || request.getOffset() + request.getChunkSize() > storage.size()) {
      logger.debug("no data for {}", request);
      refuse(responder, request, ExtendedInfo.noSliceAvailable());
      return;
    }

    int serving = myServing.incrementAndGet();
    if (serving > myMaxConcurrentServes) {
      myServing.decrementAndGet();
      logger.debug("busy serving {} requests, refusing {}", serving - 1, request);
      refuse(responder, request, ExtendedInfo.nodeBusy(serving - 1));
      return;
    }
    try {
      myExecutor.execute(new Runnable() {
        @Override
        public void run() {
          try {
            serve(request, storage, responder);
          } finally {
            myServing.decrementAndGet();
          }
        }
      });
    } catch (RejectedExecutionException e) {
      myServing.decrementAndGet();
      LoggerUtils.warnAndDebugDetails(logger, "unable to serve {}, executor is shut down", request, e);
      refuse(responder, request, ExtendedInfo.nodeBusy(0));
    }
  }

  /**
   * @return number of requests being served right now
   */
  public int getServingCount() {
    return myServing.get();
  }

  private void serve(FileFeedMessage.RequestMessage request, SliceStorage storage, Responder responder) {
    ByteBuffer data = ByteBuffer.allocate(request.getChunkSize());
    try {
      storage.read(data, request.getOffset());
    } catch (IOException e) {
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "unable to read data for {}", request, e);
      refuse(responder, request, ExtendedInfo.noSliceAvailable());
      return;
    }
    data.flip();
    responder.respond(Constants.FILE_FEED_RESPONSE, FileFeedMessage.ResponseMessage.craft(request, data).getData());
  }

  private void refuse(Responder responder, FileFeedMessage.RequestMessage request, ExtendedInfo info) {
    responder.respond(Constants.FILE_FEED_RESPONSE,
            FileFeedMessage.ResponseMessage.craftRefusal(request, info).getData());
  }
}
