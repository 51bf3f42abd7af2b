package io.github.yok.ormcontrib.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.ormcontrib.adapter.DataAccessAdapter;
import io.github.yok.ormcontrib.adapter.model.Entity;
import io.github.yok.ormcontrib.adapter.model.EntityFields;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;
import io.github.yok.ormcontrib.adapter.model.TypedList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Isolation;

class AsyncAdapterWrapperTest {

    private static final Executor DIRECT = Runnable::run;

    private final List<DataAccessAdapter> created = new ArrayList<>();

    private final Supplier<DataAccessAdapter> factory = () -> {
        DataAccessAdapter adapter = mock(DataAccessAdapter.class);
        created.add(adapter);
        return adapter;
    };

    @Test
    void fetchEntityAsync_正常ケース_同期呼び出しの結果で完了し_アダプタが閉じられること()
            throws Exception {
        Entity entity = mock(Entity.class);
        DataAccessAdapter adapter = mock(DataAccessAdapter.class);
        when(adapter.fetchEntity(entity)).thenReturn(true);
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(() -> adapter, null, DIRECT);

        CompletableFuture<Boolean> future = wrapper.fetchEntityAsync(entity);

        assertTrue(future.get());
        verify(adapter).fetchEntity(entity);
        verify(adapter).close();
    }

    @Test
    void getDbCountAsync_正常ケース_呼び出しごとに新しいアダプタが使われること() throws Exception {
        EntityFields fields = mock(EntityFields.class);
        RelationPredicateBucket filter = mock(RelationPredicateBucket.class);
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(factory, null, DIRECT);

        wrapper.getDbCountAsync(fields, filter).get();
        wrapper.getDbCountAsync(fields, filter).get();

        assertEquals(2, created.size());
        assertNotSame(created.get(0), created.get(1));
        for (DataAccessAdapter adapter : created) {
            verify(adapter).getDbCount(fields, filter);
            verify(adapter, times(1)).close();
        }
    }

    @Test
    void fetchTypedListAsync_正常ケース_戻り値なしの操作_nullで完了すること() throws Exception {
        TypedList typedList = mock(TypedList.class);
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(factory, null, DIRECT);

        assertNull(wrapper.fetchTypedListAsync(typedList).get());
        verify(created.get(0)).fetchTypedList(typedList);
        verify(created.get(0)).close();
    }

    @Test
    void createAdapterInstance_正常ケース_既定値のまま_アダプタ設定を変更しないこと() {
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(factory, "", DIRECT);

        DataAccessAdapter adapter = wrapper.createAdapterInstance();

        verify(adapter, never()).setConnectionString(any());
        verify(adapter, never()).setCommandTimeOut(anyInt());
        verify(adapter, never()).setParameterisedPrefetchPathThreshold(anyInt());
        verify(adapter, never()).setTransactionIsolationLevel(any());
    }

    @Test
    void createAdapterInstance_正常ケース_既定値以外を設定する_すべてアダプタに適用されること() {
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(factory, "jdbc:sqlserver://db;databaseName=Alt", DIRECT);
        wrapper.setCommandTimeOut(30);
        wrapper.setParameterisedPrefetchPathThreshold(75);
        wrapper.setTransactionIsolationLevel(Isolation.SERIALIZABLE);

        DataAccessAdapter adapter = wrapper.createAdapterInstance();

        verify(adapter).setConnectionString("jdbc:sqlserver://db;databaseName=Alt");
        verify(adapter).setCommandTimeOut(30);
        verify(adapter).setParameterisedPrefetchPathThreshold(75);
        verify(adapter).setTransactionIsolationLevel(Isolation.SERIALIZABLE);
    }

    @Test
    void createAdapterInstance_正常ケース_タイムアウトに0以下を設定する_適用されないこと() {
        AsyncAdapterWrapper<DataAccessAdapter> wrapper = new AsyncAdapterWrapper<>(factory);
        wrapper.setCommandTimeOut(-1);
        wrapper.setParameterisedPrefetchPathThreshold(0);

        DataAccessAdapter adapter = wrapper.createAdapterInstance();

        verify(adapter, never()).setCommandTimeOut(anyInt());
        verify(adapter, never()).setParameterisedPrefetchPathThreshold(anyInt());
    }

    @Test
    void コンストラクタ_正常ケース_接続文字列にnullを指定する_空文字として保持されること() {
        AsyncAdapterWrapper<DataAccessAdapter> wrapper = new AsyncAdapterWrapper<>(factory, null);

        assertEquals("", wrapper.getAlternativeConnectionString());
        assertEquals(Isolation.DEFAULT, wrapper.getTransactionIsolationLevel());
        assertEquals(0, wrapper.getCommandTimeOut());
    }

    @Test
    void コンストラクタ_異常ケース_ファクトリにnullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> new AsyncAdapterWrapper<>(null));
    }

    @Test
    void saveEntityAsync_異常ケース_アダプタが例外を送出する_同じ例外で完了し_アダプタが閉じられること() {
        Entity entity = mock(Entity.class);
        DataAccessAdapter adapter = mock(DataAccessAdapter.class);
        IllegalStateException failure = new IllegalStateException("concurrency violation");
        when(adapter.saveEntity(entity)).thenThrow(failure);
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(() -> adapter, null, DIRECT);

        CompletableFuture<Boolean> future = wrapper.saveEntityAsync(entity);

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertSame(failure, ex.getCause());
        verify(adapter).close();
    }

    @Test
    void deleteEntityAsync_異常ケース_ファクトリが例外を送出する_その例外で完了すること() {
        IllegalArgumentException failure = new IllegalArgumentException("bad connection string");
        AsyncAdapterWrapper<DataAccessAdapter> wrapper = new AsyncAdapterWrapper<>(() -> {
            throw failure;
        }, null, DIRECT);

        CompletableFuture<Boolean> future = wrapper.deleteEntityAsync(mock(Entity.class));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertSame(failure, ex.getCause());
    }

    @Test
    void call_異常ケース_実行器が受付を拒否する_RejectedExecutionExceptionで完了すること() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("queue full");
        };
        AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                new AsyncAdapterWrapper<>(factory, null, rejecting);

        CompletableFuture<Boolean> future = wrapper.fetchEntityAsync(mock(Entity.class));

        assertTrue(future.isCompletedExceptionally());
        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertTrue(ex.getCause() instanceof RejectedExecutionException);
        assertTrue(created.isEmpty());
    }

    @Test
    void call_正常ケース_実行器を指定する_呼び出し元と別スレッドで実行されること() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            AtomicReference<Thread> worker = new AtomicReference<>();
            AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                    new AsyncAdapterWrapper<>(factory, null, pool) {
                        @Override
                        protected DataAccessAdapter createAdapterInstance() {
                            worker.set(Thread.currentThread());
                            return super.createAdapterInstance();
                        }
                    };

            wrapper.deleteEntityCollectionAsync(null).get(5, TimeUnit.SECONDS);

            assertNotSame(Thread.currentThread(), worker.get());
            verify(created.get(0)).close();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fetchEntityAsync_正常ケース_2件を同時に実行する_呼び出し元を待たせず別々のアダプタが使われること()
            throws Exception {
        Entity entity = mock(Entity.class);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentLinkedQueue<DataAccessAdapter> prepared = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < 2; i++) {
            DataAccessAdapter adapter = mock(DataAccessAdapter.class);
            when(adapter.fetchEntity(entity)).thenAnswer(invocation -> {
                started.countDown();
                return release.await(5, TimeUnit.SECONDS);
            });
            prepared.add(adapter);
        }
        List<DataAccessAdapter> used = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            AsyncAdapterWrapper<DataAccessAdapter> wrapper =
                    new AsyncAdapterWrapper<>(() -> {
                        DataAccessAdapter adapter = prepared.poll();
                        used.add(adapter);
                        return adapter;
                    }, null, pool);

            CompletableFuture<Boolean> first = wrapper.fetchEntityAsync(entity);
            CompletableFuture<Boolean> second = wrapper.fetchEntityAsync(entity);

            assertFalse(first.isDone());
            assertFalse(second.isDone());
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertEquals(2, used.size());
            assertNotSame(used.get(0), used.get(1));

            release.countDown();

            assertTrue(first.get(5, TimeUnit.SECONDS));
            assertTrue(second.get(5, TimeUnit.SECONDS));
            for (DataAccessAdapter adapter : used) {
                verify(adapter, times(1)).close();
            }
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
