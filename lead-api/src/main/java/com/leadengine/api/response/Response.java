package com.leadengine.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装。
 *
 * @param <T> 响应数据类型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 3190225841270315527L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

}
