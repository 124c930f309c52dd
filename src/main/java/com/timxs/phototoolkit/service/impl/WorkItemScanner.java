package com.timxs.phototoolkit.service.impl;

import com.timxs.phototoolkit.config.ProcessingConfig;
import com.timxs.phototoolkit.model.ImageFormat;
import com.timxs.phototoolkit.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 工作项扫描器
 * 枚举输入目录中的图片，计算输出路径，并预先区分需要跳过的项
 */
@Slf4j
@Component
public class WorkItemScanner {

    /**
     * 输出文件已存在且未开启覆盖时的跳过原因
     */
    public static final String SKIP_REASON_EXISTS = "Output file already exists (overwrite disabled)";

    /**
     * 分类结果
     *
     * @param eligible 需要处理的工作项（保持枚举顺序）
     * @param skipped  因输出已存在而跳过的工作项（保持枚举顺序）
     */
    public record Classification(List<WorkItem> eligible, List<WorkItem> skipped) {
    }

    /**
     * 查找目录中所有支持的图片文件（非递归）
     * 列目录失败（如权限不足）时返回空列表，不视为错误
     *
     * @param folder 目录
     * @return 按文件名排序的图片文件列表
     */
    public List<Path> findImageFiles(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(folder)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(ImageFormat::isSupported)
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        } catch (IOException | UncheckedIOException | SecurityException e) {
            log.warn("无法列出目录 {}，按空目录处理: {}", folder, e.getMessage());
            return List.of();
        }
    }

    /**
     * 统计目录中支持的图片数量
     */
    public int countImages(Path folder) {
        return findImageFiles(folder).size();
    }

    /**
     * 计算输出路径
     * 规则：{前缀}{不含扩展名的文件名}{后缀}{原扩展名}，位于输出目录下
     *
     * @param inputPath 输入文件
     * @param config    批处理配置
     * @return 输出文件路径
     */
    public Path resolveOutputPath(Path inputPath, ProcessingConfig config) {
        String filename = inputPath.getFileName().toString();
        String extension = ImageFormat.extensionOf(inputPath);
        String baseName = filename.substring(0, filename.length() - extension.length());
        String newName = nullToEmpty(config.getFilenamePrefix()) + baseName
            + nullToEmpty(config.getFilenameSuffix()) + extension;
        return config.getOutputFolder().resolve(newName);
    }

    /**
     * 枚举输入目录中的所有工作项
     *
     * @param config 批处理配置
     * @return 按文件名排序的工作项
     */
    public List<WorkItem> enumerate(ProcessingConfig config) {
        List<WorkItem> items = new ArrayList<>();
        for (Path input : findImageFiles(config.getInputFolder())) {
            items.add(new WorkItem(input, resolveOutputPath(input, config), input.getFileName().toString()));
        }
        log.debug("在 {} 中找到 {} 个图片文件", config.getInputFolder(), items.size());
        return items;
    }

    /**
     * 按枚举顺序将工作项分为需要处理和需要跳过两类
     * 输出文件已存在且未开启覆盖时跳过
     *
     * @param items             工作项
     * @param overwriteExisting 是否覆盖已存在的输出
     * @return 分类结果
     */
    public Classification classify(List<WorkItem> items, boolean overwriteExisting) {
        List<WorkItem> eligible = new ArrayList<>();
        List<WorkItem> skipped = new ArrayList<>();
        for (WorkItem item : items) {
            if (!overwriteExisting && Files.exists(item.outputPath())) {
                skipped.add(item);
            } else {
                eligible.add(item);
            }
        }
        return new Classification(List.copyOf(eligible), List.copyOf(skipped));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
