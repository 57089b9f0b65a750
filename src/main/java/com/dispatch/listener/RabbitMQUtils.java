package com.dispatch.listener;

import io.vertx.core.Future;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class RabbitMQUtils
{
    private RabbitMQUtils()
    {
    }

    /**
     * Blocks the calling thread until the future completes. Never call this from a Vert.x event loop.
     *
     * @throws CompletionException wrapping the failure cause
     */
    public static <T> T await(Future<T> future)
    {
        return future.toCompletionStage()
                     .toCompletableFuture()
                     .join();
    }

    public static <T> T await(Future<T> future, long timeout, TimeUnit unit) throws TimeoutException
    {
        try
        {
            return future.toCompletionStage()
                         .toCompletableFuture()
                         .get(timeout, unit);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread()
                  .interrupt();
            throw new CompletionException(e);
        }
        catch (ExecutionException e)
        {
            throw new CompletionException(e.getCause());
        }
    }
}
