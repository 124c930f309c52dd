package com.timxs.phototoolkit;

import com.timxs.phototoolkit.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import javax.imageio.ImageIO;
import javax.imageio.spi.IIORegistry;
import javax.imageio.spi.IIOServiceProvider;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.spi.ImageWriterSpi;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Photo Batch Toolkit 装配入口
 * 扫描组件并管理 ImageIO 插件的注册和注销
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
@Configuration
@ComponentScan(basePackageClasses = PhotoToolkitConfiguration.class)
public class PhotoToolkitConfiguration implements InitializingBean, DisposableBean {

    private static final String WEBP_READER_SPI = "com.luciad.imageio.webp.WebPImageReaderSpi";

    private static final String WEBP_WRITER_SPI = "com.luciad.imageio.webp.WebPImageWriterSpi";

    /**
     * 由本类注册的 SPI 列表，关闭时注销
     */
    private final List<IIOServiceProvider> registeredSpis = new ArrayList<>();

    /**
     * 引擎运行参数，默认值见 {@link EngineProperties}
     */
    @Bean
    public EngineProperties engineProperties() {
        return new EngineProperties();
    }

    @Override
    public void afterPropertiesSet() {
        log.info("Photo Batch Toolkit 初始化中...");
        ImageIO.scanForPlugins();
        registerWebPImageIO();
        log.info("可写出的图片格式: {}", Arrays.toString(ImageIO.getWriterFormatNames()));
    }

    @Override
    public void destroy() {
        IIORegistry registry = IIORegistry.getDefaultInstance();
        for (IIOServiceProvider spi : registeredSpis) {
            try {
                registry.deregisterServiceProvider(spi);
                log.info("SPI 注销成功: {}", spi.getClass().getName());
            } catch (Exception e) {
                log.warn("SPI 注销失败: {} - {}", spi.getClass().getName(), e.getMessage());
            }
        }
        registeredSpis.clear();
    }

    /**
     * 注册 WebP ImageIO SPI
     * scanForPlugins 只扫描上下文类加载器，嵌入到其他容器时可能找不到，这里用本类的类加载器补充注册
     *
     * @return 是否支持 WebP 写出
     */
    boolean registerWebPImageIO() {
        if (ImageIO.getImageWritersByFormatName("webp").hasNext()) {
            log.debug("WebP ImageIO SPI 已可用");
            return true;
        }
        ClassLoader classLoader = getClass().getClassLoader();
        IIORegistry registry = IIORegistry.getDefaultInstance();
        try {
            ImageReaderSpi readerSpi = (ImageReaderSpi) classLoader.loadClass(WEBP_READER_SPI)
                .getDeclaredConstructor().newInstance();
            registry.registerServiceProvider(readerSpi);
            registeredSpis.add(readerSpi);

            ImageWriterSpi writerSpi = (ImageWriterSpi) classLoader.loadClass(WEBP_WRITER_SPI)
                .getDeclaredConstructor().newInstance();
            registry.registerServiceProvider(writerSpi);
            registeredSpis.add(writerSpi);
            log.info("WebP ImageIO SPI 注册成功");
            return true;
        } catch (ReflectiveOperationException | LinkageError e) {
            log.warn("WebP ImageIO SPI 不可用，webp 文件将以失败结果返回: {}", e.getMessage());
            return false;
        }
    }
}
