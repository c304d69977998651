package com.replaybot.cn.data;

import com.replaybot.cn.model.PageResult;
import com.replaybot.cn.model.ServerCandidate;
import com.replaybot.cn.model.TickRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;

/**
 * One TCP connection to a TDX quote server, set up with the three-packet handshake.
 * Calls are serialized; a session belongs to a single attempt.
 */
public final class TdxSession implements TickSession {
    private static final Logger LOG = LogManager.getLogger(TdxSession.class);

    private final ServerCandidate server;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    TdxSession(ServerCandidate server, Socket socket) throws IOException {
        this.server = server;
        this.socket = socket;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    public static TdxSession connect(ServerCandidate server, int connectTimeoutMs, int readTimeoutMs) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(server.host(), server.port()), Math.max(1, connectTimeoutMs));
            socket.setSoTimeout(Math.max(1, readTimeoutMs));
            socket.setTcpNoDelay(true);
            TdxSession session = new TdxSession(server, socket);
            session.handshake();
            return session;
        } catch (IOException | RuntimeException e) {
            closeQuietly(socket, server);
            throw e;
        }
    }

    void handshake() throws IOException {
        call(TdxProtocol.SETUP_1);
        call(TdxProtocol.SETUP_2);
        call(TdxProtocol.SETUP_3);
    }

    @Override
    public int securityCount(int market) throws IOException {
        byte[] body = call(TdxProtocol.securityCountRequest(market));
        try {
            return TdxProtocol.parseSecurityCount(body);
        } catch (IllegalStateException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public PageResult fetchPage(int market, String code, int offset, int count, int date) {
        if (offset > TdxProtocol.MAX_OFFSET) {
            return PageResult.transientFailure("offset " + offset + " exceeds protocol limit " + TdxProtocol.MAX_OFFSET);
        }
        try {
            byte[] body = call(TdxProtocol.historyTransactionRequest(market, code, offset, count, date));
            List<TickRecord> records = TdxProtocol.parseHistoryTransactions(body);
            return PageResult.of(records);
        } catch (IOException e) {
            return PageResult.transientFailure(server.label() + " io: " + describe(e));
        } catch (RuntimeException e) {
            return PageResult.transientFailure(server.label() + " decode: " + describe(e));
        }
    }

    private synchronized byte[] call(byte[] request) throws IOException {
        out.write(request);
        out.flush();
        return TdxProtocol.readResponse(in);
    }

    @Override
    public void close() {
        closeQuietly(socket, server);
    }

    private static void closeQuietly(Socket socket, ServerCandidate server) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("closing tdx socket {} failed: {}", server.label(), e.getMessage());
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
