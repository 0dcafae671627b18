package com.paperinsight.service;

import com.paperinsight.model.dto.ExtractedTextDTO;
import org.springframework.web.multipart.MultipartFile;

/**
 * 文档解析服务接口
 *
 * @author PaperInsight
 * @since 2026-09-18
 */
public interface DocumentParserService {

    /**
     * 解析上传的文档
     *
     * @param file 文件
     * @return 按页切分的文本与元数据
     */
    ExtractedTextDTO parseDocument(MultipartFile file);

    /**
     * 从字节数组解析文档
     *
     * @param fileData 文件字节数组
     * @param fileName 文件名(可为空, 仅作来源标记)
     * @return 按页切分的文本与元数据
     */
    ExtractedTextDTO parseDocument(byte[] fileData, String fileName);
}
