package xyz.firestige.rollout.domain.shared;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 部署 / 发布 ID 生成：{service}-{yyyyMMdd-HHmmss}-{8 位十六进制}
 * 秒级时间戳后追加随机段，同一秒内的多次尝试也不会重复
 */
public final class IdGenerator {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private IdGenerator() {
    }

    public static String next(String serviceName) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return serviceName + "-" + LocalDateTime.now().format(FORMATTER) + "-" + suffix;
    }
}
