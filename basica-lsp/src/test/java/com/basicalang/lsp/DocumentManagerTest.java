package com.basicalang.lsp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DocumentManager 测试")
class DocumentManagerTest {

    private static final String URI = "file:///test.bas";

    private DocumentManager manager;

    @BeforeEach
    void setUp() {
        manager = new DocumentManager(50);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Nested
    @DisplayName("文档存储")
    class Storage {

        @Test
        @DisplayName("打开文档后可获取内容")
        void testOpenAndGetContent() {
            manager.open(URI, "10 PRINT 1");
            assertThat(manager.getContent(URI)).isEqualTo("10 PRINT 1");
            assertThat(manager.isOpen(URI)).isTrue();
        }

        @Test
        @DisplayName("未打开的文档返回 null")
        void testGetContentNotOpened() {
            assertThat(manager.getContent("file:///unknown.bas")).isNull();
            assertThat(manager.isOpen("file:///unknown.bas")).isFalse();
        }

        @Test
        @DisplayName("更新文档内容")
        void testChange() {
            manager.open(URI, "10 X = 1");
            manager.change(URI, "10 X = 2");
            assertThat(manager.getContent(URI)).isEqualTo("10 X = 2");
        }

        @Test
        @DisplayName("关闭文档后不可获取")
        void testClose() {
            manager.open(URI, "10 X = 1");
            manager.close(URI);
            assertThat(manager.getContent(URI)).isNull();
            assertThat(manager.isOpen(URI)).isFalse();
        }

        @Test
        @DisplayName("read 在读锁下执行查询，未打开时传入 null")
        void testRead() {
            manager.open(URI, "10 END");
            Integer length = manager.read(URI, String::length);
            String missing = manager.read("file:///none.bas", content -> content == null ? "missing" : content);

            assertThat(length).isEqualTo(6);
            assertThat(missing).isEqualTo("missing");
        }

        @Test
        @DisplayName("管理多个文档")
        void testMultipleDocuments() {
            manager.open("file:///a.bas", "10 A = 1");
            manager.open("file:///b.bas", "10 B = 2");

            assertThat(manager.getContent("file:///a.bas")).isEqualTo("10 A = 1");
            assertThat(manager.getContent("file:///b.bas")).isEqualTo("10 B = 2");

            manager.close("file:///a.bas");
            assertThat(manager.isOpen("file:///a.bas")).isFalse();
            assertThat(manager.isOpen("file:///b.bas")).isTrue();
        }
    }

    @Nested
    @DisplayName("变更回调")
    class Callback {

        @Test
        @DisplayName("连续变更只回调一次，内容为最后一次")
        void testDebounce() throws InterruptedException {
            AtomicInteger calls = new AtomicInteger();
            AtomicReference<String> last = new AtomicReference<>();
            CountDownLatch latch = new CountDownLatch(1);
            manager.setChangeCallback((uri, content) -> {
                calls.incrementAndGet();
                last.set(content);
                latch.countDown();
            });

            manager.open(URI, "10 A");
            manager.change(URI, "10 B");
            manager.change(URI, "10 C");
            manager.change(URI, "10 D");

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(200);
            assertThat(calls.get()).isEqualTo(1);
            assertThat(last.get()).isEqualTo("10 D");
        }

        @Test
        @DisplayName("打开文档不触发回调")
        void testOpenDoesNotNotify() throws InterruptedException {
            AtomicInteger calls = new AtomicInteger();
            manager.setChangeCallback((uri, content) -> calls.incrementAndGet());

            manager.open(URI, "10 A");

            Thread.sleep(200);
            assertThat(calls.get()).isZero();
        }

        @Test
        @DisplayName("关闭文档取消待执行的回调")
        void testCloseCancelsPending() throws InterruptedException {
            AtomicInteger calls = new AtomicInteger();
            manager.setChangeCallback((uri, content) -> calls.incrementAndGet());

            manager.open(URI, "10 A");
            manager.change(URI, "10 B");
            manager.close(URI);

            Thread.sleep(200);
            assertThat(calls.get()).isZero();
        }

        @Test
        @DisplayName("回调抛出的异常不影响后续变更")
        void testCallbackFailure() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(2);
            manager.setChangeCallback((uri, content) -> {
                latch.countDown();
                throw new IllegalStateException("boom");
            });

            manager.open(URI, "10 A");
            manager.change(URI, "10 B");
            Thread.sleep(150);
            manager.change(URI, "10 C");

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }
}
