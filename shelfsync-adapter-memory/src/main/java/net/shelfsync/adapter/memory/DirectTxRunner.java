package net.shelfsync.adapter.memory;

import net.shelfsync.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** 인메모리 저장소용. 각 저장소 메서드가 스스로 원자적이므로 트랜잭션 경계가 없다. */
public final class DirectTxRunner implements TxRunner {
    @Override
    public <T> T required(Callable<T> body) throws Exception { return body.call(); }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
}
