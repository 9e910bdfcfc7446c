package com.photofeed.feedcache.service;

import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.entity.CommentRecord;
import com.photofeed.feedcache.entity.PostRecord;
import com.photofeed.feedcache.exception.PostNotFoundException;
import com.photofeed.feedcache.repository.ContentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * 写路径：先写存储，再失效缓存，返回时调用方已能读到自己的写入
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentWriter {

    static final Set<String> ALLOWED_MIMES = Set.of("image/jpeg", "image/png", "image/gif");

    private final ContentRepository contentRepository;
    private final InvalidationCoordinator invalidationCoordinator;
    private final PhotoFeedProperties properties;
    private final Clock clock;

    public PostRecord createPost(long userId, String mime, byte[] image, String body) {
        if (mime == null || !ALLOWED_MIMES.contains(mime)) {
            throw new IllegalArgumentException("Unsupported image type: " + mime);
        }
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Image is required");
        }
        long limit = properties.getUploadLimit().toBytes();
        if (image.length > limit) {
            throw new IllegalArgumentException("Image too large: " + image.length + " > " + limit);
        }

        PostRecord post = contentRepository.insertPost(userId, mime, image, body, now());
        invalidationCoordinator.onPostCreated(post);
        log.info("Post created: postId={}, userId={}, bytes={}", post.getId(), userId, image.length);
        return post;
    }

    public CommentRecord createComment(long userId, long postId, String comment) {
        if (comment == null || comment.isBlank()) {
            throw new IllegalArgumentException("Comment is required");
        }
        PostRecord post = contentRepository.findPostById(postId).orElseThrow(() -> new PostNotFoundException(postId));

        CommentRecord record = contentRepository.insertComment(postId, userId, comment, now());
        invalidationCoordinator.onCommentCreated(record, post.getUserId());
        log.info("Comment created: commentId={}, postId={}, userId={}", record.getId(), postId, userId);
        return record;
    }

    public void deletePost(long postId) {
        PostRecord post = contentRepository.findPostById(postId).orElseThrow(() -> new PostNotFoundException(postId));
        if (contentRepository.deletePost(postId)) {
            invalidationCoordinator.onPostDeleted(post);
            log.info("Post deleted: postId={}", postId);
        }
    }

    /**
     * 管理员封禁
     */
    public void deactivateUser(long userId) {
        if (contentRepository.deactivateUser(userId)) {
            invalidationCoordinator.onUserDeactivated(userId);
            log.info("User deactivated: userId={}", userId);
        } else {
            log.warn("Deactivate skipped, user not found: userId={}", userId);
        }
    }

    /**
     * 与 DATETIME 列的秒精度一致，缓存中的时间与回源读到的相同
     */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
