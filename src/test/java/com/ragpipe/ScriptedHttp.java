package com.ragpipe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * Answers every call from an in-memory handler so HTTP clients can be tested without sockets.
 */
public final class ScriptedHttp implements Interceptor {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final Function<Exchange, Reply> handler;
    private final List<Exchange> exchanges = Collections.synchronizedList(new ArrayList<>());

    public ScriptedHttp(Function<Exchange, Reply> handler) {
        this.handler = handler;
    }

    public static ScriptedHttp always(int code, String body) {
        return new ScriptedHttp(exchange -> new Reply(code, body));
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public List<Exchange> exchanges() {
        synchronized (exchanges) {
            return List.copyOf(exchanges);
        }
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String body = "";
        if (request.body() != null) {
            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            body = buffer.readUtf8();
        }
        Exchange exchange = new Exchange(request.method(), request.url().encodedPath(), body, request.header("Authorization"));
        exchanges.add(exchange);
        Reply reply = handler.apply(exchange);
        if (reply.failure() != null) {
            throw reply.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("scripted")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    public record Exchange(String method, String path, String body, String authorization) {
    }

    public record Reply(int code, String body, IOException failure) {
        public Reply(int code, String body) {
            this(code, body, null);
        }

        public static Reply ok(String body) {
            return new Reply(200, body);
        }

        public static Reply transportFailure(String message) {
            return new Reply(0, "", new IOException(message));
        }
    }
}
