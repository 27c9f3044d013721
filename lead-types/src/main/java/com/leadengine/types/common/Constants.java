package com.leadengine.types.common;

/**
 * 全局常量定义。
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** 深链启动令牌前缀，格式 start_{vertical}_{tenantId} */
    public final static String BOOTSTRAP_TOKEN_PREFIX = "start_";

    /** 会话缓存 key 前缀 */
    public final static String SESSION_KEY_PREFIX = "lead:session:";

}
