package com.photofeed.feedcache.exception;

/**
 * 帖子不存在异常
 */
public class PostNotFoundException extends PhotoFeedException {

    private final long postId;

    public PostNotFoundException(long postId) {
        super("Post not found: " + postId);
        this.postId = postId;
    }

    public long getPostId() {
        return postId;
    }
}
