package org.iceforge.imagecache;

import org.iceforge.imagecache.aws.ImageCacheAwsProperties;
import org.iceforge.imagecache.cache.ImageCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ImageCacheAwsProperties.class, ImageCacheProperties.class})
public class ImageCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(ImageCacheApplication.class, args);
	}
}
