package com.example.interviewreminder.store;

/**
 * In-app notification feed of platform users.
 */
public interface InAppNotificationStore {

    void create(String userId, String type, String title, String message, String link);
}
