package com.producthub.prefetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Product Hub 预测式数据预取服务启动类
 * 
 * 观察路由跳转、数据访问与界面交互，预测后续数据需求，
 * 在并发预算内提前把数据写入缓存
 */
@SpringBootApplication
public class PrefetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrefetchApplication.class, args);
    }
}
