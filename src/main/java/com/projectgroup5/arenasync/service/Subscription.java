package com.projectgroup5.arenasync.service;

/**
 * 订阅句柄，cancel 之后不再收到消息（重复调用无副作用）
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
