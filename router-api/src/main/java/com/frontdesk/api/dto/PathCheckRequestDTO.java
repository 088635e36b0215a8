package com.frontdesk.api.dto;

import lombok.Data;

/**
 * 运行时路径判定请求 DTO。
 */
@Data
public class PathCheckRequestDTO {

    private String matchSource;
    private String checkpoint;
    private String branchTaken;
}
