package com.basicalang.lsp;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 文档管理器
 *
 * <p>管理当前打开的文档内容，支持 LSP 的 textDocument/didOpen、didChange、didClose。
 * 只做全量同步：每次变更整体替换文本。</p>
 * <p>didChange 之后经 debounce 回调发布诊断，过期版本的回调直接跳过。</p>
 */
public class DocumentManager {
    private static final Logger LOG = Logger.getLogger(DocumentManager.class.getName());

    /** URI -> 文档内容，由读写锁保护 */
    private final Map<String, String> documents = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** URI -> 待执行的 debounce 任务 */
    private final Map<String, ScheduledFuture<?>> pendingAnalysis = new ConcurrentHashMap<>();

    /** 文档版本计数器（全局递增） */
    private final AtomicLong versionCounter = new AtomicLong(0);

    /** URI -> 当前版本号（用于防止关闭/更新后旧回调回写） */
    private final Map<String, Long> documentVersions = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "basica-lsp-diagnostics");
        t.setDaemon(true);
        return t;
    });

    /** debounce 延迟（毫秒） */
    private volatile long debounceMs;

    /** 变更生效回调（用于触发诊断发布） */
    private volatile ChangeCallback changeCallback;

    @FunctionalInterface
    public interface ChangeCallback {
        void onDocumentChanged(String uri, String content);
    }

    public DocumentManager() {
        this(BasicaSettings.defaults().getDiagnosticsDelayMs());
    }

    public DocumentManager(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public void setChangeCallback(ChangeCallback callback) {
        this.changeCallback = callback;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    /**
     * 打开文档（不触发回调，由调用方立即发布诊断）
     */
    public void open(String uri, String content) {
        lock.writeLock().lock();
        try {
            documents.put(uri, content);
        } finally {
            lock.writeLock().unlock();
        }
        documentVersions.put(uri, versionCounter.incrementAndGet());
    }

    /**
     * 整体替换文档内容（debounce 延迟回调）
     */
    public void change(String uri, String content) {
        lock.writeLock().lock();
        try {
            documents.put(uri, content);
        } finally {
            lock.writeLock().unlock();
        }
        long version = versionCounter.incrementAndGet();
        documentVersions.put(uri, version);
        scheduleCallback(uri, content, version);
    }

    /**
     * 关闭文档
     */
    public void close(String uri) {
        documentVersions.remove(uri);
        lock.writeLock().lock();
        try {
            documents.remove(uri);
        } finally {
            lock.writeLock().unlock();
        }
        ScheduledFuture<?> pending = pendingAnalysis.remove(uri);
        if (pending != null) pending.cancel(false);
    }

    /**
     * 在读锁下对文档内容执行查询，文档未打开时传入 null
     */
    public <T> T read(String uri, Function<String, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(documents.get(uri));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 获取文档内容
     */
    public String getContent(String uri) {
        return read(uri, Function.identity());
    }

    /**
     * 检查文档是否已打开
     */
    public boolean isOpen(String uri) {
        return getContent(uri) != null;
    }

    /**
     * 关闭调度器，释放线程资源
     */
    public void shutdown() {
        scheduler.shutdown();
    }

    /**
     * 带 debounce 的延迟回调
     *
     * @param version 调度时的文档版本，回调时校验是否过期
     */
    private void scheduleCallback(String uri, String content, long version) {
        ScheduledFuture<?> prev = pendingAnalysis.remove(uri);
        if (prev != null) prev.cancel(false);

        ScheduledFuture<?> future;
        try {
            future = scheduler.schedule(() -> {
                pendingAnalysis.remove(uri);
                // 版本校验：文档已关闭或已有更新则跳过
                Long currentVersion = documentVersions.get(uri);
                if (currentVersion == null || currentVersion != version) return;

                ChangeCallback cb = changeCallback;
                if (cb == null) return;
                try {
                    cb.onDocumentChanged(uri, content);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "变更回调失败: " + uri, e);
                }
            }, debounceMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.log(Level.WARNING, "调度器已关闭，忽略变更: " + uri, e);
            return;
        }
        pendingAnalysis.put(uri, future);
    }
}
