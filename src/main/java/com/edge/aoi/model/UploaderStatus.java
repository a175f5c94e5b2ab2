package com.edge.aoi.model;

/**
 * 上传服务整体状态
 */
public enum UploaderStatus {
    /**
     * 启动后尚未完成任何一次运行
     */
    GREY,

    /**
     * 最近一次运行全部上传成功
     */
    GREEN,

    /**
     * 数据库不可用，或最近一次运行有批次上传失败
     */
    RED
}
