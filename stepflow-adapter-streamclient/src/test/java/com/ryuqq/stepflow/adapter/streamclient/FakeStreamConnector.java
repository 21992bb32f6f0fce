package com.ryuqq.stepflow.adapter.streamclient;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 커넥터. 열린 연결을 기록하고, 테스트가 직접 open/message/error를 발생시킵니다.
 */
class FakeStreamConnector implements StreamConnector {

    private final List<FakeConnection> connections = new ArrayList<>();

    @Override
    public synchronized StreamConnection open(String streamId, StreamListener listener) {
        FakeConnection connection = new FakeConnection(streamId, listener);
        connections.add(connection);
        return connection;
    }

    synchronized int openCount() {
        return connections.size();
    }

    synchronized FakeConnection latest() {
        return connections.get(connections.size() - 1);
    }

    synchronized FakeConnection get(int index) {
        return connections.get(index);
    }

    static final class FakeConnection implements StreamConnection {

        private final String streamId;
        private final StreamListener listener;
        private volatile boolean closed;

        FakeConnection(String streamId, StreamListener listener) {
            this.streamId = streamId;
            this.listener = listener;
        }

        void open() {
            listener.onOpen();
        }

        void send(String message) {
            listener.onMessage(message);
        }

        void fail() {
            listener.onError(new java.io.IOException("connection refused"));
        }

        boolean isClosed() {
            return closed;
        }

        @Override
        public String streamId() {
            return streamId;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
