package com.branchfeatures.fixture;

public class BinarySearch {

    public static int binarySearch(int[] arr, int l, int r, int x) {
        while (l <= r) {
            int mid = l + (r - l) / 2;
            if (arr[mid] == x) return mid;
            if (arr[mid] < x) l = mid + 1;
            else r = mid - 1;
        }
        return -1;
    }

    public static void main(String[] args) {
        int[] arr = {1, 3, 5, 7, 9};
        int result = binarySearch(arr, 0, arr.length - 1, 5);
        System.out.println(result != -1 ? "Found" : "Not Found");
    }
}
