package com.autoping.monitor.ping.notify;

import com.autoping.monitor.config.MonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.AWTError;
import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Image;
import java.awt.SystemTray;
import java.awt.TrayIcon;
import java.awt.image.BufferedImage;

/**
 * Fire-and-forget local toast. Falls back to a log line when no system tray is available.
 * Spring Boot starts headless, so tray messages only appear with {@code -Djava.awt.headless=false}.
 */
@Component
public class DesktopNotifier {
    private static final Logger log = LoggerFactory.getLogger(DesktopNotifier.class);

    private final MonitorProperties properties;
    private final Object trayLock = new Object();
    private TrayIcon trayIcon;

    public DesktopNotifier(MonitorProperties properties) {
        this.properties = properties;
    }

    public boolean notify(String title, String message) {
        if (!properties.getDesktop().isEnabled() || GraphicsEnvironment.isHeadless()) {
            log.info("Desktop notification (not shown): {} - {}", title, message);
            return false;
        }
        try {
            if (!SystemTray.isSupported()) {
                log.info("System tray unsupported; notification: {} - {}", title, message);
                return false;
            }
            TrayIcon icon = trayIcon();
            icon.displayMessage(title, message, TrayIcon.MessageType.WARNING);
            log.info("Desktop notification shown: {}", title);
            return true;
        } catch (Exception | AWTError e) {
            log.warn("Desktop notification failed: {}", e.getMessage());
            return false;
        }
    }

    private TrayIcon trayIcon() throws AWTException {
        synchronized (trayLock) {
            if (trayIcon == null) {
                Image image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);
                TrayIcon icon = new TrayIcon(image, "AutoPing");
                icon.setImageAutoSize(true);
                SystemTray.getSystemTray().add(icon);
                trayIcon = icon;
            }
            return trayIcon;
        }
    }
}
