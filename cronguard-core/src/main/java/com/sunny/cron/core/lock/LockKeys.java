package com.sunny.cron.core.lock;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.common.Constants;

/**
 * 锁 Key 构建：{namespace}:cronjob:{jobId}
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class LockKeys {

    private LockKeys() {
    }

    public static String of(String namespace, String jobId) {
        Assert.notBlank(namespace, "namespace 不能为空");
        Assert.notBlank(jobId, "jobId 不能为空");
        return namespace + ":" + Constants.LOCK_KEY_SEGMENT + ":" + jobId;
    }
}
