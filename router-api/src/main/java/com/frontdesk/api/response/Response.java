package com.frontdesk.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应信封：code 为 "0000" 表示成功，失败时 data 为空或为错误信封。
 *
 * @param <T> 响应数据类型
 * @author frontdesk
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 2318846520183947621L;

    private String code;

    private String info;

    private T data;

}
