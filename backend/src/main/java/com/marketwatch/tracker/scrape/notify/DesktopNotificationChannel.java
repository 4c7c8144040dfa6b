package com.marketwatch.tracker.scrape.notify;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.model.NotificationEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Image;
import java.awt.SystemTray;
import java.awt.TrayIcon;
import java.awt.image.BufferedImage;

@Component
public class DesktopNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(DesktopNotificationChannel.class);

    private final ScraperProperties properties;
    private TrayIcon trayIcon;

    public DesktopNotificationChannel(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "desktop";
    }

    @Override
    public boolean isEnabled() {
        return properties.getNotifications().getDesktop().isEnabled();
    }

    @Override
    public void deliver(NotificationEvent event) throws DeliveryException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new DeliveryException("desktop notifications unavailable in headless environment");
        }
        if (!SystemTray.isSupported()) {
            throw new DeliveryException("system tray not supported");
        }
        int previewLimit = properties.getNotifications().getDesktop().getPreviewLimit();
        trayIcon().displayMessage(
            NotificationMessages.title(event),
            NotificationMessages.body(event, previewLimit),
            TrayIcon.MessageType.INFO
        );
    }

    private synchronized TrayIcon trayIcon() throws DeliveryException {
        if (trayIcon == null) {
            Image image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);
            TrayIcon icon = new TrayIcon(image, "Market watch");
            icon.setImageAutoSize(true);
            try {
                SystemTray.getSystemTray().add(icon);
            } catch (AWTException e) {
                throw new DeliveryException("could not add tray icon", e);
            }
            trayIcon = icon;
        }
        return trayIcon;
    }

    @PreDestroy
    public synchronized void removeTrayIcon() {
        if (trayIcon != null) {
            SystemTray.getSystemTray().remove(trayIcon);
            trayIcon = null;
            log.debug("Tray icon removed");
        }
    }
}
