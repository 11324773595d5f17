package com.textworld.adventureservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 叙事生成专用线程池：开场与回合结算的 AI 调用在这里执行，与房间计时线程分开，
 * 避免慢速生成占住计时线程。
 */
@Configuration
public class NarrationExecutorConfig {

	@Value("${scheduler.narration.poolSize:0}")
	private int poolSize;

	@Bean("narrationExecutor")
	public ExecutorService narrationExecutor() {
		int size = poolSize > 0 ? poolSize : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
		return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
				new ThreadFactory() {
					private final AtomicInteger idx = new AtomicInteger(1);
					@Override
					public Thread newThread(Runnable r) {
						Thread t = new Thread(r, "narration-" + idx.getAndIncrement());
						// 设置为守护线程
						t.setDaemon(true);
						return t;
					}
				});
	}
}
